package com.proofaudit.pdg.lex;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits comment-free vernacular text into sentences.
 *
 * A sentence ends at a period that is followed by whitespace or the end of the
 * input and is not inside a string literal. A period followed by anything else
 * belongs to a qualified identifier ({@code Nat.add}) or a number and does not
 * split. Double quotes toggle the string state; Coq's doubled-quote escape
 * toggles twice and so needs no special case.
 *
 * Input is expected to have gone through {@link CommentStripper} first.
 */
public final class SentenceSplitter {
    private SentenceSplitter() {
        // Utility class
    }

    public static List<Sentence> split(String text) {
        List<Sentence> sentences = new ArrayList<>();
        StringBuilder current = new StringBuilder(256);
        final int n = text.length();
        int line = 1;
        int startLine = -1;
        boolean inString = false;

        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            if (startLine < 0 && !Character.isWhitespace(c))
                startLine = line;

            if (c == '"') {
                inString = !inString;
                current.append(c);
            } else if (!inString && c == '.' && (i + 1 >= n || isBlank(text.charAt(i + 1)))) {
                current.append(c);
                emit(sentences, current, startLine);
                startLine = -1;
            } else {
                current.append(c);
            }

            if (c == '\n')
                line++;
        }
        emit(sentences, current, startLine);
        return sentences;
    }

    static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static void emit(List<Sentence> out, StringBuilder current, int startLine) {
        String s = current.toString().trim();
        if (!s.isEmpty())
            out.add(new Sentence(s, startLine));
        current.setLength(0);
    }
}
