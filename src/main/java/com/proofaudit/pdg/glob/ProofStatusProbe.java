package com.proofaudit.pdg.glob;

import com.proofaudit.pdg.lex.ByteSentences;
import com.proofaudit.pdg.model.SymbolStatus;
import com.proofaudit.pdg.scan.VernacularKeywords;

/**
 * Decides the status of a provable declaration by reading the sentences that
 * follow its statement.
 *
 * The first proof terminator decides. If another top-level command comes
 * first, the declaration had an inline body and is reported
 * {@link SymbolStatus#DEFINED}; so is a declaration whose scan window runs
 * out.
 */
public final class ProofStatusProbe {
    private final int scanLimitBytes;

    public ProofStatusProbe(int scanLimitBytes) {
        if (scanLimitBytes <= 0)
            throw new IllegalArgumentException("scanLimitBytes must be > 0");
        this.scanLimitBytes = scanLimitBytes;
    }

    /**
     * @param stripped  comment-stripped source bytes
     * @param nameStart offset of the declared name; the statement is the
     *                  sentence containing it
     */
    public SymbolStatus probe(byte[] stripped, int nameStart) {
        final int n = stripped.length;
        int i = ByteSentences.endOfSentence(stripped, nameStart, n);
        final int limit = (int) Math.min((long) i + scanLimitBytes, n);
        while (i < limit) {
            i = ByteSentences.skipBlank(stripped, i, limit);
            if (i >= limit)
                break;
            int end = ByteSentences.endOfSentence(stripped, i, limit);
            String body = trimPeriods(ByteSentences.decode(stripped, i, end).trim());
            SymbolStatus status = SymbolStatus.fromSentence(body);
            if (status != null)
                return status;
            if (VernacularKeywords.startsTopLevelCommand(body))
                return SymbolStatus.DEFINED;
            i = end;
        }
        return SymbolStatus.DEFINED;
    }

    private static String trimPeriods(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '.')
            end--;
        return s.substring(0, end);
    }
}
