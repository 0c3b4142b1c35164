package com.proofaudit.pdg.lex;

import java.nio.charset.StandardCharsets;

/**
 * Sentence navigation over raw bytes, for the metadata front-end where every
 * position is a byte offset.
 *
 * Operates on comment-stripped bytes (see {@link CommentStripper#strip(byte[])}),
 * so only string literals need tracking.
 */
public final class ByteSentences {
    private ByteSentences() {
        // Utility class
    }

    public static boolean isBlank(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r';
    }

    /** First non-blank position at or after {@code from}, or {@code limit}. */
    public static int skipBlank(byte[] bytes, int from, int limit) {
        int i = from;
        while (i < limit && isBlank(bytes[i]))
            i++;
        return i;
    }

    /**
     * Position just past the period that terminates the sentence containing
     * {@code from}. Returns {@code limit} when no terminator is found.
     */
    public static int endOfSentence(byte[] bytes, int from, int limit) {
        boolean inString = false;
        for (int i = Math.max(0, from); i < limit; i++) {
            byte b = bytes[i];
            if (b == '"') {
                inString = !inString;
            } else if (!inString && b == '.' && (i + 1 >= bytes.length || isBlank(bytes[i + 1]))) {
                return i + 1;
            }
        }
        return limit;
    }

    public static String decode(byte[] bytes, int from, int to) {
        return new String(bytes, from, Math.max(0, to - from), StandardCharsets.UTF_8);
    }
}
