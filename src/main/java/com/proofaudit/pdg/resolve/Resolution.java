package com.proofaudit.pdg.resolve;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of resolving one declaration's references.
 *
 * @param dependencies qualified names inside the project, in discovery order;
 *                     may include names that no scanned declaration owns
 * @param externals    references that leave the project
 */
public record Resolution(Set<String> dependencies, Set<String> externals) {
    public static final Resolution EMPTY = new Resolution(Set.of(), Set.of());

    public Resolution {
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        externals = Collections.unmodifiableSet(new LinkedHashSet<>(externals));
    }
}
