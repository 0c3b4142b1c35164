package com.proofaudit.pdg.engine;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Forward reachability along the dependents relation.
 *
 * Algorithm:
 * 1. For every seed, run one breadth-first traversal over the dependents CSR
 * rows. A node is enqueued at most once per traversal.
 * 2. Every node reached, the seed included, is tainted and gets the seed added
 * to its sources.
 * 3. The number of nodes reached, the seed excluded, is the seed's blast
 * radius. A cycle leading back to the seed does not count it.
 *
 * Visited state is an {@code int} stamp per node instead of a boolean array, so
 * consecutive traversals need no clearing. Nothing recurses; cycles are safe.
 *
 * A propagator holds scratch arrays and is not thread-safe. The results it
 * returns are immutable.
 */
public final class TaintPropagator {
    private static final Logger log = LogManager.getLogger(TaintPropagator.class);

    private final DependencyGraph graph;
    private final int[] visitStamp;
    private final int[] queue;
    private int stamp;

    public TaintPropagator(DependencyGraph graph) {
        this.graph = graph;
        this.visitStamp = new int[graph.nodeCount()];
        this.queue = new int[graph.nodeCount()];
    }

    /**
     * Propagates taint from the given seeds. Seeds unknown to the graph are
     * ignored.
     */
    @SuppressWarnings("unchecked")
    public TaintResult propagate(Collection<String> seeds) {
        final int n = graph.nodeCount();
        boolean[] tainted = new boolean[n];
        SortedSet<String>[] sources = new SortedSet[n];
        Map<String, Integer> radius = new TreeMap<>();

        for (String seed : seeds) {
            if (!graph.contains(seed)) {
                log.debug("Taint seed {} is not in the graph", seed);
                continue;
            }
            int reached = traverse(graph.index(seed));
            for (int q = 0; q < reached; q++) {
                int i = queue[q];
                tainted[i] = true;
                if (sources[i] == null)
                    sources[i] = new TreeSet<>();
                sources[i].add(seed);
            }
            radius.put(seed, reached - 1);
        }
        return new TaintResult(graph, tainted, sources, radius);
    }

    /** Number of symbols transitively depending on {@code name}, itself excluded. */
    public int blastRadius(String name) {
        return traverse(graph.index(name)) - 1;
    }

    /** Symbols transitively depending on {@code name}, itself excluded, sorted. */
    public SortedSet<String> affectedBy(String name) {
        int start = graph.index(name);
        int reached = traverse(start);
        SortedSet<String> out = new TreeSet<>();
        for (int q = 0; q < reached; q++)
            if (queue[q] != start)
                out.add(graph.name(queue[q]));
        return out;
    }

    /**
     * BFS from {@code start}. On return {@code queue[0..count)} holds every
     * node reached, {@code start} first.
     */
    private int traverse(int start) {
        final int s = ++stamp;
        int head = 0, tail = 0;
        queue[tail++] = start;
        visitStamp[start] = s;
        while (head < tail) {
            int curr = queue[head++];
            final int from = graph.dependentsStart(curr);
            final int to = graph.dependentsEnd(curr);
            for (int k = from; k < to; k++) {
                int d = graph.dependentAt(k);
                if (visitStamp[d] != s) {
                    visitStamp[d] = s;
                    queue[tail++] = d;
                }
            }
        }
        return tail;
    }
}
