package com.proofaudit.pdg.model;

import java.util.List;

/** Everything one front-end recovered from one file. */
public record FileScan(SourceFile file, List<ScannedDeclaration> declarations) {
    public FileScan {
        declarations = List.copyOf(declarations);
    }
}
