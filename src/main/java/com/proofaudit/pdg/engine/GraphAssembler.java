package com.proofaudit.pdg.engine;

import com.proofaudit.pdg.FrontEnd;
import com.proofaudit.pdg.ProjectGraph;
import com.proofaudit.pdg.model.*;
import com.proofaudit.pdg.resolve.ReferenceResolver;
import com.proofaudit.pdg.resolve.Resolution;
import com.proofaudit.pdg.resolve.StructuralResolver;
import com.proofaudit.pdg.resolve.SymbolTable;
import com.proofaudit.pdg.resolve.TextualResolver;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Whole-project pass run once every file has been scanned.
 *
 * Steps:
 * 1. Register all declarations in a {@link SymbolTable}, in scan order.
 * 2. Resolve each declaration's references with the front-end's resolver.
 * 3. Build the {@link DependencyGraph} over project symbols.
 * 4. Propagate taint from every admitted or assumed symbol.
 * 5. Freeze the {@link Symbol}s and compute the statistics.
 */
@Log4j2
public final class GraphAssembler {
    private final FrontEnd frontEnd;
    private final boolean proofBodyReferences;

    public GraphAssembler(FrontEnd frontEnd, boolean proofBodyReferences) {
        this.frontEnd = frontEnd;
        this.proofBodyReferences = proofBodyReferences;
    }

    public ProjectGraph assemble(List<FileScan> scans) {
        // 1. Symbol table
        SymbolTable.Builder tableBuilder = SymbolTable.builder();
        for (FileScan scan : scans) {
            tableBuilder.addModule(scan.file().logicalModulePath());
            for (ScannedDeclaration d : scan.declarations())
                tableBuilder.register(d);
        }
        SymbolTable table = tableBuilder.build();
        List<ScannedDeclaration> decls = new ArrayList<>(table.declarations());

        // 2. Resolution
        ReferenceResolver resolver = frontEnd == FrontEnd.METADATA
                ? new StructuralResolver(table)
                : new TextualResolver(table, proofBodyReferences);
        List<Resolution> resolutions = new ArrayList<>(decls.size());
        for (ScannedDeclaration d : decls)
            resolutions.add(resolver.resolve(d));

        // 3. Graph; unresolved-internal names stay out of it
        DependencyGraph.Builder gb = DependencyGraph.builder();
        for (ScannedDeclaration d : decls)
            gb.addNode(d.qualifiedName());
        for (int i = 0; i < decls.size(); i++)
            for (String dep : resolutions.get(i).dependencies())
                if (table.contains(dep))
                    gb.addEdge(decls.get(i).qualifiedName(), dep);
        DependencyGraph graph = gb.build();

        // 4. Taint
        List<String> seeds = new ArrayList<>();
        for (ScannedDeclaration d : decls)
            if (d.status().isUnproven())
                seeds.add(d.qualifiedName());
        TaintResult taint = new TaintPropagator(graph).propagate(seeds);

        // 5. Freeze
        List<Symbol> symbols = new ArrayList<>(decls.size());
        for (int i = 0; i < decls.size(); i++) {
            ScannedDeclaration d = decls.get(i);
            Resolution r = resolutions.get(i);
            symbols.add(new Symbol(d.name(), d.qualifiedName(), d.kind(), d.keyword(), d.kindCode(), d.status(),
                    d.file(), d.line(), d.byteRange(), d.statement(), new TreeSet<>(r.dependencies()),
                    new TreeSet<>(graph.dependents(d.qualifiedName())), new TreeSet<>(r.externals()),
                    taint.isTainted(i), taint.sources(i)));
        }

        List<SourceFile> files = scans.stream().map(FileScan::file).toList();
        ProjectStats stats = stats(symbols, files, taint);
        log.info("Assembled {} symbols, {} edges, {} tainted, {} unused", symbols.size(), graph.edgeCount(),
                stats.tainted(), stats.unused());
        return new ProjectGraph(symbols, files, stats);
    }

    private ProjectStats stats(List<Symbol> symbols, List<SourceFile> files, TaintResult taint) {
        Map<SymbolStatus, Integer> byStatus = new EnumMap<>(SymbolStatus.class);
        Map<SymbolKind, Integer> byKind = new EnumMap<>(SymbolKind.class);
        SortedMap<String, Integer> byKeyword = new TreeMap<>();
        int unused = 0;
        for (Symbol s : symbols) {
            byStatus.merge(s.status(), 1, Integer::sum);
            byKind.merge(s.kind(), 1, Integer::sum);
            byKeyword.merge(s.keyword(), 1, Integer::sum);
            if (s.isUnused())
                unused++;
        }

        SortedMap<String, String> moduleMap = new TreeMap<>();
        SortedMap<String, List<String>> imports = new TreeMap<>();
        for (SourceFile f : files) {
            if (f.logicalModulePath() != null)
                moduleMap.putIfAbsent(f.logicalModulePath(), f.path());
            imports.put(f.path(), f.imports());
        }

        List<ProjectStats.BlastRadius> ranking = new ArrayList<>();
        for (Symbol s : symbols)
            if (s.status() == SymbolStatus.ADMITTED)
                ranking.add(new ProjectStats.BlastRadius(s.qualifiedName(),
                        taint.seedRadius().getOrDefault(s.qualifiedName(), 0)));
        ranking.sort(Comparator.comparingInt(ProjectStats.BlastRadius::radius).reversed()
                .thenComparing(ProjectStats.BlastRadius::qualifiedName));

        return new ProjectStats(symbols.size(), files.size(), byStatus, byKind, byKeyword, taint.taintedCount(),
                unused, fileDependencies(symbols, files, moduleMap), imports, moduleMap, ranking);
    }

    /**
     * Metadata: referenced modules mapped to the files declaring them.
     * Heuristic: files of the symbols each file's symbols depend on.
     */
    private SortedMap<String, List<String>> fileDependencies(List<Symbol> symbols, List<SourceFile> files,
            Map<String, String> moduleMap) {
        Map<String, SortedSet<String>> deps = new TreeMap<>();
        for (SourceFile f : files)
            deps.put(f.path(), new TreeSet<>());

        if (frontEnd == FrontEnd.METADATA) {
            for (SourceFile f : files) {
                for (String module : f.referencedModules()) {
                    String target = moduleMap.get(module);
                    if (target != null && !target.equals(f.path()))
                        deps.get(f.path()).add(target);
                }
            }
        } else {
            Map<String, String> fileOf = new HashMap<>(symbols.size() * 2);
            for (Symbol s : symbols)
                fileOf.put(s.qualifiedName(), s.file());
            for (Symbol s : symbols) {
                for (String dep : s.dependencies()) {
                    String target = fileOf.get(dep);
                    if (target != null && !target.equals(s.file()))
                        deps.computeIfAbsent(s.file(), k -> new TreeSet<>()).add(target);
                }
            }
        }

        SortedMap<String, List<String>> out = new TreeMap<>();
        deps.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return out;
    }
}
