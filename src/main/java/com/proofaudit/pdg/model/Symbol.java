package com.proofaudit.pdg.model;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A named declaration in the analyzed development, fully resolved.
 *
 * Symbols are built once by the graph assembler after every file has been
 * scanned and never change afterwards. All set-valued fields are unmodifiable
 * and sorted, so iteration order is stable across runs.
 *
 * @param name                 bare identifier
 * @param qualifiedName        scope-prefixed name, unique in the project
 * @param kind                 coarse kind group
 * @param keyword              display kind, e.g. "lemma", "definition"
 * @param kindCode             raw metadata kind code, null for the heuristic
 *                             front-end
 * @param status               trust status
 * @param file                 declaring file (relative path)
 * @param line                 1-based line of the declaration
 * @param byteRange            location of the name, null when unknown
 * @param statement            declaration signature without the proof body
 * @param dependencies         qualified names this symbol refers to; may
 *                             contain in-project names that did not resolve to
 *                             a scanned symbol
 * @param dependents           project symbols referring to this one
 * @param externalDependencies references leaving the project, for display only
 * @param tainted              true if this symbol rests on an admitted or
 *                             assumed claim
 * @param taintSources         the admitted/assumed symbols responsible
 */
public record Symbol(
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
        SortedSet<String> dependencies,
        SortedSet<String> dependents,
        SortedSet<String> externalDependencies,
        boolean tainted,
        SortedSet<String> taintSources) {

    public Symbol {
        dependencies = frozen(dependencies);
        dependents = frozen(dependents);
        externalDependencies = frozen(externalDependencies);
        taintSources = frozen(taintSources);
        if (dependencies.contains(qualifiedName))
            throw new IllegalArgumentException("Symbol depends on itself: " + qualifiedName);
    }

    /** Nothing in the project refers to this symbol. */
    public boolean isUnused() {
        return dependents.isEmpty();
    }

    private static SortedSet<String> frozen(Set<String> values) {
        return Collections.unmodifiableSortedSet(values == null ? new TreeSet<>() : new TreeSet<>(values));
    }
}
