package com.proofaudit.pdg;

/** Which scanner recovers symbols from the source units. */
public enum FrontEnd {
    /** Keyword-driven scan of the vernacular text alone. */
    HEURISTIC,
    /** Compiler cross-reference metadata ({@code .glob}) plus the source bytes. */
    METADATA;

    public static FrontEnd fromString(String text) {
        for (FrontEnd f : values()) {
            if (f.name().equalsIgnoreCase(text)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown FrontEnd: " + text);
    }
}
