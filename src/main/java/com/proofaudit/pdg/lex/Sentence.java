package com.proofaudit.pdg.lex;

/**
 * One vernacular command, trimmed, including its terminating period.
 *
 * @param text the sentence text
 * @param line 1-based line of its first non-blank character
 */
public record Sentence(String text, int line) {

    /** Text without the trailing period(s), trimmed. */
    public String body() {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '.')
            end--;
        return text.substring(0, end).trim();
    }
}
