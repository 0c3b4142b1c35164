package com.proofaudit.pdg.scan;

/**
 * What the heuristic scanner reports for a declaration whose proof is still
 * open at end of file.
 */
public enum UnterminatedProofPolicy {
    /** Report {@code UNTERMINATED}, keeping the gap visible. */
    MARK_UNTERMINATED,
    /**
     * Report the status a completed proof would most likely have:
     * {@code PROVED} for provables and instances, {@code DEFINED} for
     * definitions in tactic mode. Silently trusts truncated files.
     */
    ASSUME_COMPLETE
}
