package com.proofaudit.pdg.glob;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed {@code .glob} file.
 *
 * @param logicalPath logical module path from the {@code F} line, or empty
 * @param preamble    references seen before the first definition
 * @param scopes      every definition with the references that follow it, in
 *                    file order
 */
public record GlobFile(String logicalPath, List<GlobReference> preamble, List<Scope> scopes) {

    public GlobFile {
        preamble = List.copyOf(preamble);
        scopes = List.copyOf(scopes);
    }

    public List<GlobReference> allReferences() {
        List<GlobReference> all = new ArrayList<>(preamble);
        for (Scope s : scopes)
            all.addAll(s.references());
        return all;
    }

    /** A definition and the references attributed to it. */
    public record Scope(GlobDefinition definition, List<GlobReference> references) {
        public Scope {
            references = List.copyOf(references);
        }
    }
}
