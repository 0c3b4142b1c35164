package com.proofaudit.pdg.util;

import com.proofaudit.pdg.ProjectGraph;
import com.proofaudit.pdg.model.ProjectStats;
import com.proofaudit.pdg.model.Symbol;
import com.proofaudit.pdg.model.SymbolStatus;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting an analyzed project.
 *
 * <p>
 * Generates human-readable text for a single symbol, for the whole project's
 * statistics, and for the full edge list.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions, logs and test failure
 * messages. Reports and renderers should read {@link ProjectGraph} directly.
 */
public final class GraphExplain {
    private final ProjectGraph graph;

    public GraphExplain(ProjectGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps everything known about one symbol.
     *
     * @param name qualified or bare name
     * @throws IllegalArgumentException if the name does not resolve
     */
    public String explainSymbol(String name) {
        Symbol s = graph.resolve(name);
        if (s == null)
            throw new IllegalArgumentException("Unknown symbol: " + name);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Symbol: ").append(s.qualifiedName()).append('\n')
                .append("  Kind: ").append(s.keyword()).append(" (").append(s.kind()).append(")\n")
                .append("  Status: ").append(s.status()).append('\n')
                .append("  Location: ").append(s.file()).append(':').append(s.line());
        if (s.byteRange() != null)
            sb.append(" [").append(s.byteRange()).append(']');
        sb.append('\n')
                .append("  Statement: ").append(s.statement()).append('\n');
        appendList(sb, "Dependencies", s.dependencies());
        appendList(sb, "Dependents", s.dependents());
        if (!s.externalDependencies().isEmpty())
            appendList(sb, "External", s.externalDependencies());
        sb.append("  Tainted: ").append(s.tainted());
        if (s.tainted())
            sb.append(" by ").append(String.join(", ", s.taintSources()));
        sb.append('\n')
                .append("  Blast radius: ").append(graph.blastRadius(s.qualifiedName())).append('\n');
        return sb.toString();
    }

    /** One screen of aggregate figures. */
    public String summary() {
        ProjectStats st = graph.stats();
        StringBuilder sb = new StringBuilder(512);
        sb.append("Project: ").append(st.totalSymbols()).append(" symbols in ").append(st.files())
                .append(" files\n");
        sb.append("  Status:");
        for (SymbolStatus status : SymbolStatus.values())
            sb.append(' ').append(status.name().toLowerCase()).append('=').append(st.count(status));
        sb.append('\n');
        sb.append("  Keywords:");
        for (Map.Entry<String, Integer> e : st.byKeyword().entrySet())
            sb.append(' ').append(e.getKey()).append('=').append(e.getValue());
        sb.append('\n');
        sb.append("  Tainted: ").append(st.tainted()).append(", unused: ").append(st.unused()).append('\n');
        List<ProjectStats.BlastRadius> admitted = st.admittedBlastRadius();
        if (!admitted.isEmpty()) {
            sb.append("  Admitted by blast radius:\n");
            for (ProjectStats.BlastRadius b : admitted)
                sb.append("    ").append(b.qualifiedName()).append(" -> ").append(b.radius()).append('\n');
        }
        return sb.toString();
    }

    /** Every symbol with its dependents, in registration order. */
    public String dump() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.size()).append(" symbols):\n");
        int i = 0;
        for (Symbol s : graph.symbols()) {
            sb.append("  [").append(i++).append("] ").append(s.qualifiedName())
                    .append(" (").append(s.status().name().toLowerCase()).append(')');
            if (s.tainted())
                sb.append(" TAINTED");
            if (!s.dependents().isEmpty()) {
                sb.append(" -> ");
                join(sb, s.dependents());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String label, Collection<String> values) {
        sb.append("  ").append(label).append(" (").append(values.size()).append("): ");
        join(sb, values);
        sb.append('\n');
    }

    private static void join(StringBuilder sb, Collection<String> values) {
        Iterator<String> it = values.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext())
                sb.append(", ");
        }
    }
}
