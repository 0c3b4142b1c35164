package com.proofaudit.pdg;

import com.proofaudit.pdg.engine.DependencyGraph;
import com.proofaudit.pdg.engine.TaintPropagator;
import com.proofaudit.pdg.model.ProjectStats;
import com.proofaudit.pdg.model.SourceFile;
import com.proofaudit.pdg.model.Symbol;
import com.proofaudit.pdg.model.SymbolStatus;

import java.util.*;

/**
 * The frozen result of an analysis: every symbol with its edges, taint and
 * liveness, the scanned files, and aggregate statistics.
 *
 * <p>
 * Read-only and safe for concurrent queries. Name lookup is two-level:
 * {@link #resolve(String)} tries the qualified name first and falls back to the
 * bare name, where the symbol listed first owns a shared bare name.
 */
public final class ProjectGraph {
    private final List<Symbol> symbols;
    private final Map<String, Symbol> byQualified;
    private final Map<String, Symbol> byShort;
    private final List<SourceFile> files;
    private final ProjectStats stats;
    private final DependencyGraph graph;

    /**
     * @param symbols symbols in registration order; qualified names must be
     *                unique
     * @param files   successfully scanned files, in input order
     * @param stats   statistics over {@code symbols}
     * @throws IllegalArgumentException on a duplicate qualified name
     */
    public ProjectGraph(List<Symbol> symbols, List<SourceFile> files, ProjectStats stats) {
        this.symbols = List.copyOf(symbols);
        this.files = List.copyOf(files);
        this.stats = stats;

        Map<String, Symbol> qualified = new LinkedHashMap<>(symbols.size() * 2);
        Map<String, Symbol> shortNames = new HashMap<>(symbols.size() * 2);
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (Symbol s : this.symbols) {
            builder.addNode(s.qualifiedName());
            qualified.put(s.qualifiedName(), s);
            shortNames.putIfAbsent(s.name(), s);
        }
        for (Symbol s : this.symbols)
            for (String dep : s.dependencies())
                if (qualified.containsKey(dep))
                    builder.addEdge(s.qualifiedName(), dep);

        this.byQualified = Collections.unmodifiableMap(qualified);
        this.byShort = Collections.unmodifiableMap(shortNames);
        this.graph = builder.build();
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    /** Symbol with exactly this qualified name, or null. */
    public Symbol symbol(String qualifiedName) {
        return byQualified.get(qualifiedName);
    }

    /** Qualified name first, bare name second; null if neither matches. */
    public Symbol resolve(String name) {
        Symbol s = byQualified.get(name);
        return s != null ? s : byShort.get(name);
    }

    public List<SourceFile> files() {
        return files;
    }

    /** File path to the other files it depends on. */
    public SortedMap<String, List<String>> fileDependencies() {
        return stats.fileDependencies();
    }

    public ProjectStats stats() {
        return stats;
    }

    public int size() {
        return symbols.size();
    }

    /**
     * Every symbol that transitively depends on {@code qualifiedName}: what may
     * break if it changes.
     *
     * @throws IllegalArgumentException if no such symbol exists
     */
    public SortedSet<String> affectedBy(String qualifiedName) {
        return new TaintPropagator(graph).affectedBy(qualifiedName);
    }

    /** Size of {@link #affectedBy(String)}. */
    public int blastRadius(String qualifiedName) {
        return new TaintPropagator(graph).blastRadius(qualifiedName);
    }

    /** Symbols nothing in the project refers to. */
    public List<Symbol> unused() {
        return symbols.stream().filter(Symbol::isUnused).toList();
    }

    public List<Symbol> tainted() {
        return symbols.stream().filter(Symbol::tainted).toList();
    }

    public List<Symbol> withStatus(SymbolStatus status) {
        return symbols.stream().filter(s -> s.status() == status).toList();
    }
}
