package com.proofaudit.pdg.model;

/**
 * Byte extent of a name in a source file, as reported by compiler metadata.
 * Both ends are inclusive, matching the metadata format.
 */
public record ByteRange(int start, int end) {
    public ByteRange {
        if (start < 0 || end < start)
            throw new IllegalArgumentException("Invalid byte range " + start + ":" + end);
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
