package com.proofaudit.pdg.lex;

import java.util.Arrays;

/**
 * Maps byte offsets of a UTF-8 file to 1-based line numbers.
 *
 * Stores only the offsets of newline bytes; lookup is a binary search.
 */
public final class LineIndex {
    private final int[] newlines;
    private final int count;

    private LineIndex(int[] newlines, int count) {
        this.newlines = newlines;
        this.count = count;
    }

    public static LineIndex of(byte[] bytes) {
        int[] offsets = new int[64];
        int count = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                if (count == offsets.length)
                    offsets = Arrays.copyOf(offsets, count * 2);
                offsets[count++] = i;
            }
        }
        return new LineIndex(offsets, count);
    }

    /**
     * Line containing {@code offset}. A newline byte belongs to the line it
     * terminates. Negative offsets map to line 1, offsets past the end to the
     * last line.
     */
    public int lineOf(int offset) {
        if (offset <= 0)
            return 1;
        int idx = Arrays.binarySearch(newlines, 0, count, offset);
        // Exact hit: the newline ends line idx+1. Miss: idx is -(insertion point)-1.
        return idx >= 0 ? idx + 1 : -idx;
    }

    public int lineCount() {
        return count + 1;
    }
}
