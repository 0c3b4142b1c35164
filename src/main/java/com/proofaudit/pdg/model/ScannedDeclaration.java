package com.proofaudit.pdg.model;

import java.util.List;

/**
 * A declaration as recovered by a front-end, before name resolution.
 *
 * Values are immutable; the scanners derive updated copies while a file is
 * being folded (e.g. when a proof terminator finalizes the status).
 *
 * @param proofText  proof-internal text seen between the statement and its
 *                   terminator; heuristic front-end only, empty otherwise
 * @param references raw references scoped to this declaration; metadata
 *                   front-end only, empty otherwise
 */
public record ScannedDeclaration(
        String name,
        String qualifiedName,
        SymbolKind kind,
        String keyword,
        String kindCode,
        SymbolStatus status,
        String file,
        int line,
        ByteRange byteRange,
        String statement,
        String proofText,
        List<RawReference> references) {

    public ScannedDeclaration {
        references = List.copyOf(references);
        proofText = proofText == null ? "" : proofText;
    }

    public ScannedDeclaration withStatus(SymbolStatus newStatus) {
        return new ScannedDeclaration(name, qualifiedName, kind, keyword, kindCode, newStatus, file, line,
                byteRange, statement, proofText, references);
    }

    public ScannedDeclaration appendProof(String sentence) {
        String text = proofText.isEmpty() ? sentence : proofText + " " + sentence;
        return new ScannedDeclaration(name, qualifiedName, kind, keyword, kindCode, status, file, line,
                byteRange, statement, text, references);
    }
}
