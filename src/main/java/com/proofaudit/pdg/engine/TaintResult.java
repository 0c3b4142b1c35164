package com.proofaudit.pdg.engine;

import java.util.*;

/**
 * Outcome of one taint propagation over a {@link DependencyGraph}.
 *
 * Immutable. {@link #sources(String)} lists, for a symbol, every seed from
 * which it is reachable along dependents; a seed is its own source.
 */
public final class TaintResult {
    private final DependencyGraph graph;
    private final boolean[] tainted;
    private final SortedSet<String>[] sources;
    private final Map<String, Integer> seedRadius;
    private final int taintedCount;

    TaintResult(DependencyGraph graph, boolean[] tainted, SortedSet<String>[] sources,
            Map<String, Integer> seedRadius) {
        this.graph = graph;
        this.tainted = tainted;
        this.sources = sources;
        this.seedRadius = Collections.unmodifiableMap(seedRadius);
        int count = 0;
        for (boolean t : tainted)
            if (t)
                count++;
        this.taintedCount = count;
    }

    public boolean isTainted(String name) {
        return tainted[graph.index(name)];
    }

    public boolean isTainted(int i) {
        return tainted[i];
    }

    /** Unmodifiable, sorted; empty for untainted symbols. */
    public SortedSet<String> sources(String name) {
        return sources(graph.index(name));
    }

    public SortedSet<String> sources(int i) {
        return sources[i] == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(sources[i]);
    }

    public int taintedCount() {
        return taintedCount;
    }

    /** Seeds that were present in the graph, with their blast radius. */
    public Map<String, Integer> seedRadius() {
        return seedRadius;
    }

    public Set<String> tainted() {
        Set<String> out = new TreeSet<>();
        for (int i = 0; i < tainted.length; i++)
            if (tainted[i])
                out.add(graph.name(i));
        return out;
    }
}
