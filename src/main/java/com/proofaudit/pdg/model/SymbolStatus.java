package com.proofaudit.pdg.model;

import java.util.regex.Pattern;

/**
 * Trust status of a symbol as recovered from source.
 */
public enum SymbolStatus {
    PROVED,
    ADMITTED,
    DEFINED,
    ASSUMED,
    ABORTED,
    /**
     * A proof was opened but no terminator was found before end of file. The
     * declaration may be complete in a real build, but the scan cannot tell.
     */
    UNTERMINATED;

    /** Focusing braces and bullets are not period-terminated and lead the next sentence. */
    private static final Pattern FOCUS_PREFIX = Pattern.compile("^[\\s{}+*-]+");

    /** Seeds of taint: claims accepted without proof. */
    public boolean isUnproven() {
        return this == ADMITTED || this == ASSUMED;
    }

    /**
     * Maps a proof terminator keyword to the status it finalizes.
     *
     * @return the status, or null if {@code keyword} is not a terminator.
     */
    public static SymbolStatus fromTerminator(String keyword) {
        return switch (keyword) {
            case "Qed" -> PROVED;
            case "Admitted" -> ADMITTED;
            case "Defined" -> DEFINED;
            case "Abort" -> ABORTED;
            default -> null;
        };
    }

    /**
     * Like {@link #fromTerminator(String)}, for a whole sentence body: leading
     * braces and bullets such as {@code "} Qed"} or {@code "- Admitted"} are
     * skipped first.
     */
    public static SymbolStatus fromSentence(String body) {
        return fromTerminator(FOCUS_PREFIX.matcher(body).replaceFirst(""));
    }

    public static SymbolStatus fromString(String text) {
        for (SymbolStatus s : values()) {
            if (s.name().equalsIgnoreCase(text)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown SymbolStatus: " + text);
    }
}
