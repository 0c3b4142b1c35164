package com.proofaudit.pdg.lex;

/**
 * Blanks out nested {@code (* ... *)} comments.
 *
 * Every character inside a comment, delimiters included, becomes a single
 * space; newlines are kept. The output therefore has exactly the length and
 * line structure of the input, so line numbers and offsets computed on the
 * stripped text are valid for the original.
 *
 * Comments nest: {@code (* a (* b *) c *)} is one comment. A stray close
 * delimiter outside any comment is blanked and otherwise ignored.
 */
public final class CommentStripper {
    private CommentStripper() {
        // Utility class
    }

    public static String strip(String text) {
        char[] out = text.toCharArray();
        final int n = out.length;
        int depth = 0;
        int i = 0;
        while (i < n) {
            char c = out[i];
            if (c == '(' && i + 1 < n && out[i + 1] == '*') {
                depth++;
                out[i] = ' ';
                out[i + 1] = ' ';
                i += 2;
            } else if (c == '*' && i + 1 < n && out[i + 1] == ')') {
                depth = Math.max(0, depth - 1);
                out[i] = ' ';
                out[i + 1] = ' ';
                i += 2;
            } else {
                if (depth > 0 && c != '\n')
                    out[i] = ' ';
                i++;
            }
        }
        return new String(out);
    }

    /**
     * Byte-exact variant. Works on the raw UTF-8 bytes so byte offsets reported
     * by compiler metadata stay valid. Multi-byte characters inside a comment
     * turn into one space per byte.
     */
    public static byte[] strip(byte[] raw) {
        byte[] out = raw.clone();
        final int n = out.length;
        int depth = 0;
        int i = 0;
        while (i < n) {
            byte b = out[i];
            if (b == '(' && i + 1 < n && out[i + 1] == '*') {
                depth++;
                out[i] = ' ';
                out[i + 1] = ' ';
                i += 2;
            } else if (b == '*' && i + 1 < n && out[i + 1] == ')') {
                depth = Math.max(0, depth - 1);
                out[i] = ' ';
                out[i + 1] = ' ';
                i += 2;
            } else {
                if (depth > 0 && b != '\n')
                    out[i] = ' ';
                i++;
            }
        }
        return out;
    }
}
