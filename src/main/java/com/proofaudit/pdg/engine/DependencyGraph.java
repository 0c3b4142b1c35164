package com.proofaudit.pdg.engine;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * CSR-encoded bidirectional symbol graph.
 *
 * <p>
 * Nodes are project symbols, indexed in registration order. Each node carries
 * two adjacency rows:
 * <ul>
 * <li><b>dependencies:</b> the symbols it refers to;</li>
 * <li><b>dependents:</b> the symbols referring to it, the exact inverse.</li>
 * </ul>
 * Both rows are flattened into one {@code int} array each, indexed by an offset
 * array, and sorted by node index.
 *
 * <p>
 * Cycles are legal (mutually recursive definitions, instances referring to
 * each other). Nothing here orders the nodes; traversals must bound
 * themselves with a visited set.
 *
 * <p>
 * Immutable once built; safe for concurrent reads.
 */
@Log4j2
public final class DependencyGraph {
    private final String[] names;
    private final Map<String, Integer> nameToIndex;

    // depOffset[i]..depOffset[i+1] delimits node i's dependencies in depList.
    private final int[] depOffset;
    private final int[] depList;

    // Same layout for the inverse relation.
    private final int[] rdepOffset;
    private final int[] rdepList;

    private DependencyGraph(String[] names, Map<String, Integer> nameToIndex, int[] depOffset, int[] depList,
            int[] rdepOffset, int[] rdepList) {
        this.names = names;
        this.nameToIndex = nameToIndex;
        this.depOffset = depOffset;
        this.depList = depList;
        this.rdepOffset = rdepOffset;
        this.rdepList = rdepList;
    }

    public int nodeCount() {
        return names.length;
    }

    public int edgeCount() {
        return depList.length;
    }

    public String name(int i) {
        return names[i];
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    /** Resolves a qualified name to its node index. */
    public int index(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown symbol: " + name);
        return idx;
    }

    public int dependencyCount(int i) {
        return depOffset[i + 1] - depOffset[i];
    }

    public int dependency(int i, int k) {
        return depList[depOffset[i] + k];
    }

    public int dependentCount(int i) {
        return rdepOffset[i + 1] - rdepOffset[i];
    }

    public int dependent(int i, int k) {
        return rdepList[rdepOffset[i] + k];
    }

    public int dependentsStart(int i) {
        return rdepOffset[i];
    }

    public int dependentsEnd(int i) {
        return rdepOffset[i + 1];
    }

    public int dependentAt(int flatIndex) {
        return rdepList[flatIndex];
    }

    public List<String> dependencies(String name) {
        int i = index(name);
        List<String> out = new ArrayList<>(dependencyCount(i));
        for (int k = depOffset[i]; k < depOffset[i + 1]; k++)
            out.add(names[depList[k]]);
        return out;
    }

    public List<String> dependents(String name) {
        int i = index(name);
        List<String> out = new ArrayList<>(dependentCount(i));
        for (int k = rdepOffset[i]; k < rdepOffset[i + 1]; k++)
            out.add(names[rdepList[k]]);
        return out;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects nodes and edges. Duplicate edges collapse into one.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<Set<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(String name) {
            if (nameToIdx.containsKey(name))
                throw new IllegalArgumentException("Duplicate symbol: " + name);
            nameToIdx.put(name, nodes.size());
            nodes.add(name);
            forwardEdges.add(new TreeSet<>());
            return this;
        }

        /** Records that {@code from} depends on {@code to}. */
        public Builder addEdge(String from, String to) {
            int f = requireIndex(from);
            int t = requireIndex(to);
            if (f == t)
                throw new IllegalArgumentException("Symbol cannot depend on itself: " + from);
            forwardEdges.get(f).add(t);
            return this;
        }

        public boolean contains(String name) {
            return nameToIdx.containsKey(name);
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown symbol: " + name);
            return idx;
        }

        public DependencyGraph build() {
            final int n = nodes.size();

            // 1. Forward CSR. TreeSet rows are already sorted.
            int[] depOffset = new int[n + 1];
            for (int i = 0; i < n; i++)
                depOffset[i + 1] = depOffset[i] + forwardEdges.get(i).size();
            int[] depList = new int[depOffset[n]];
            int[] inDegree = new int[n];
            for (int i = 0; i < n; i++) {
                int k = depOffset[i];
                for (int t : forwardEdges.get(i)) {
                    depList[k++] = t;
                    inDegree[t]++;
                }
            }

            // 2. Inverse CSR. Filling sources in ascending order keeps rows sorted.
            int[] rdepOffset = new int[n + 1];
            for (int i = 0; i < n; i++)
                rdepOffset[i + 1] = rdepOffset[i] + inDegree[i];
            int[] cursor = Arrays.copyOf(rdepOffset, n);
            int[] rdepList = new int[depList.length];
            for (int i = 0; i < n; i++)
                for (int k = depOffset[i]; k < depOffset[i + 1]; k++)
                    rdepList[cursor[depList[k]]++] = i;

            log.debug("Dependency graph: {} symbols, {} edges", n, depList.length);
            return new DependencyGraph(nodes.toArray(new String[0]), Map.copyOf(nameToIdx), depOffset, depList,
                    rdepOffset, rdepList);
        }
    }
}
