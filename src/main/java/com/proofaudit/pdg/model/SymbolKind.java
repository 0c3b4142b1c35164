package com.proofaudit.pdg.model;

/**
 * Coarse classification of a declaration.
 *
 * The first five groups are the ones the heuristic scanner recognizes from
 * vernacular keywords. The remaining ones only come out of compiler metadata,
 * which also reports constructors, projections and proof steps.
 */
public enum SymbolKind {
    /** Lemma, Theorem, Corollary and friends. Ends with a proof terminator. */
    PROVABLE,
    /** Definition, Fixpoint, Let, Function. */
    DEFINITIONAL,
    /** Inductive, Record, Class, Variant. */
    TYPE_FORMER,
    /** Axiom, Parameter, Hypothesis. Always assumed, never proved. */
    ASSUMPTION,
    /** Typeclass instances; may carry a proof like a provable. */
    INSTANCE,
    CONSTRUCTOR,
    PROJECTION,
    PROOF_STEP;

    public static SymbolKind fromString(String text) {
        for (SymbolKind k : values()) {
            if (k.name().equalsIgnoreCase(text)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown SymbolKind: " + text);
    }
}
