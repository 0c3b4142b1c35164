package com.proofaudit.pdg.glob;

import com.proofaudit.pdg.lex.ByteSentences;
import com.proofaudit.pdg.model.ByteRange;
import com.proofaudit.pdg.scan.VernacularKeywords;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Recovers the statement text around a name reported by compiler metadata.
 *
 * Searches backwards from the name, within a bounded window, for the nearest
 * declaration keyword, then forwards to the end of the sentence. Expects
 * comment-stripped bytes so that offsets still line up with the metadata.
 */
public final class StatementExtractor {
    public static final String TRUNCATION_MARKER = " ...";

    private static final List<byte[]> KEYWORDS = VernacularKeywords.STATEMENT_KEYWORDS.stream()
            .map(k -> k.getBytes(StandardCharsets.US_ASCII))
            .toList();

    private final int windowBytes;
    private final int maxLength;

    public StatementExtractor(int windowBytes, int maxLength) {
        if (windowBytes < 0 || maxLength <= 0)
            throw new IllegalArgumentException("windowBytes must be >= 0 and maxLength > 0");
        this.windowBytes = windowBytes;
        this.maxLength = maxLength;
    }

    /**
     * @param stripped comment-stripped source bytes
     * @param name     extent of the declared name
     * @return the statement with whitespace collapsed, possibly truncated;
     *         empty if the range lies outside the source
     */
    public String extract(byte[] stripped, ByteRange name) {
        int start = name.start();
        if (start >= stripped.length)
            return "";
        int from = keywordStart(stripped, start);
        int to = ByteSentences.endOfSentence(stripped, start, stripped.length);
        String text = ByteSentences.decode(stripped, from, to).replaceAll("\\s+", " ").trim();
        if (text.length() > maxLength)
            text = text.substring(0, maxLength) + TRUNCATION_MARKER;
        return text;
    }

    /**
     * Start of the keyword closest to {@code nameStart}. On a tie of end
     * positions the longer keyword wins, so "Global Instance" beats
     * "Instance". Falls back to the name itself.
     */
    int keywordStart(byte[] bytes, int nameStart) {
        int windowStart = Math.max(0, nameStart - windowBytes);
        int bestStart = nameStart;
        int bestEnd = -1;
        int bestLength = 0;
        for (byte[] kw : KEYWORDS) {
            for (int pos = nameStart - kw.length; pos >= windowStart; pos--) {
                if (matchesWord(bytes, pos, kw)) {
                    int end = pos + kw.length;
                    if (end > bestEnd || (end == bestEnd && kw.length > bestLength)) {
                        bestStart = pos;
                        bestEnd = end;
                        bestLength = kw.length;
                    }
                    break;
                }
            }
        }
        return bestStart;
    }

    private static boolean matchesWord(byte[] bytes, int pos, byte[] kw) {
        for (int i = 0; i < kw.length; i++) {
            if (bytes[pos + i] != kw[i])
                return false;
        }
        if (pos > 0 && isIdentByte(bytes[pos - 1]))
            return false;
        int after = pos + kw.length;
        return after >= bytes.length || !isIdentByte(bytes[after]);
    }

    /** Non-ASCII bytes count as identifier bytes: they can only be part of a letter here. */
    private static boolean isIdentByte(byte b) {
        return b < 0 || b == '_' || b == '\'' || Character.isLetterOrDigit(b);
    }
}
