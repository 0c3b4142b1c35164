package com.proofaudit.pdg.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.proofaudit.pdg.ProjectGraph;
import com.proofaudit.pdg.model.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Converts a {@link ProjectGraph} to and from {@link GraphRecord} JSON.
 *
 * Loading a written graph reproduces every symbol field, file and statistic.
 * Collections are written sorted, so equal graphs give identical text.
 */
@Log4j2
public final class GraphRecordCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private GraphRecordCodec() {
        // Utility class
    }

    public static String toJson(ProjectGraph graph) {
        try {
            return MAPPER.writeValueAsString(toRecord(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize project graph", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid graph record
     */
    public static ProjectGraph fromJson(String json) {
        try {
            return fromRecord(MAPPER.readValue(json, GraphRecord.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph record: " + e.getOriginalMessage(), e);
        }
    }

    public static void write(ProjectGraph graph, Path file) {
        try {
            MAPPER.writeValue(file.toFile(), toRecord(graph));
            log.info("Wrote {} symbols to {}", graph.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    public static ProjectGraph read(Path file) {
        try {
            return fromRecord(MAPPER.readValue(file.toFile(), GraphRecord.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public static GraphRecord toRecord(ProjectGraph graph) {
        GraphRecord rec = new GraphRecord();
        List<GraphRecord.SymbolRecord> symbols = new ArrayList<>(graph.size());
        for (Symbol s : graph.symbols())
            symbols.add(symbolRecord(s));
        rec.setSymbols(symbols);

        List<GraphRecord.FileRecord> files = new ArrayList<>();
        for (SourceFile f : graph.files()) {
            GraphRecord.FileRecord fr = new GraphRecord.FileRecord();
            fr.setPath(f.path());
            fr.setLogicalModulePath(f.logicalModulePath());
            fr.setImports(f.imports());
            fr.setDeclaredSymbols(sorted(f.declaredSymbols()));
            fr.setReferencedModules(sorted(f.referencedModules()));
            files.add(fr);
        }
        rec.setFiles(files);
        rec.setStats(statsRecord(graph.stats()));
        return rec;
    }

    public static ProjectGraph fromRecord(GraphRecord rec) {
        if (rec.getFormatVersion() != GraphRecord.FORMAT_VERSION)
            throw new IllegalArgumentException("Unsupported graph record version " + rec.getFormatVersion());

        List<Symbol> symbols = new ArrayList<>();
        for (GraphRecord.SymbolRecord r : orEmpty(rec.getSymbols())) {
            ByteRange range = r.getByteStart() == null ? null : new ByteRange(r.getByteStart(), r.getByteEnd());
            symbols.add(new Symbol(r.getName(), r.getQualifiedName(), SymbolKind.fromString(r.getKind()),
                    r.getKeyword(), r.getKindCode(), SymbolStatus.fromString(r.getStatus()), r.getFile(),
                    r.getLine(), range, r.getStatement(), new TreeSet<>(orEmpty(r.getDependencies())),
                    new TreeSet<>(orEmpty(r.getDependents())), new TreeSet<>(orEmpty(r.getExternalDependencies())),
                    r.isTainted(), new TreeSet<>(orEmpty(r.getTaintSources()))));
        }

        List<SourceFile> files = new ArrayList<>();
        for (GraphRecord.FileRecord f : orEmpty(rec.getFiles()))
            files.add(new SourceFile(f.getPath(), f.getLogicalModulePath(), orEmpty(f.getImports()),
                    new LinkedHashSet<>(orEmpty(f.getDeclaredSymbols())),
                    new LinkedHashSet<>(orEmpty(f.getReferencedModules()))));

        return new ProjectGraph(symbols, files, stats(rec.getStats()));
    }

    private static GraphRecord.SymbolRecord symbolRecord(Symbol s) {
        GraphRecord.SymbolRecord r = new GraphRecord.SymbolRecord();
        r.setName(s.name());
        r.setQualifiedName(s.qualifiedName());
        r.setKind(s.kind().name());
        r.setKeyword(s.keyword());
        r.setKindCode(s.kindCode());
        r.setStatus(s.status().name());
        r.setFile(s.file());
        r.setLine(s.line());
        if (s.byteRange() != null) {
            r.setByteStart(s.byteRange().start());
            r.setByteEnd(s.byteRange().end());
        }
        r.setStatement(s.statement());
        r.setDependencies(List.copyOf(s.dependencies()));
        r.setDependents(List.copyOf(s.dependents()));
        r.setExternalDependencies(List.copyOf(s.externalDependencies()));
        r.setTainted(s.tainted());
        r.setTaintSources(List.copyOf(s.taintSources()));
        return r;
    }

    private static GraphRecord.StatsRecord statsRecord(ProjectStats stats) {
        GraphRecord.StatsRecord r = new GraphRecord.StatsRecord();
        r.setTotalSymbols(stats.totalSymbols());
        r.setFiles(stats.files());
        r.setTainted(stats.tainted());
        r.setUnused(stats.unused());
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        stats.byStatus().forEach((k, v) -> byStatus.put(k.name(), v));
        r.setByStatus(byStatus);
        Map<String, Integer> byKind = new LinkedHashMap<>();
        stats.byKind().forEach((k, v) -> byKind.put(k.name(), v));
        r.setByKind(byKind);
        r.setByKeyword(stats.byKeyword());
        r.setFileDependencies(stats.fileDependencies());
        r.setImports(stats.imports());
        r.setModuleMap(stats.moduleMap());
        List<GraphRecord.BlastRecord> blast = new ArrayList<>();
        for (ProjectStats.BlastRadius b : stats.admittedBlastRadius()) {
            GraphRecord.BlastRecord br = new GraphRecord.BlastRecord();
            br.setQualifiedName(b.qualifiedName());
            br.setRadius(b.radius());
            blast.add(br);
        }
        r.setAdmittedBlastRadius(blast);
        return r;
    }

    private static ProjectStats stats(GraphRecord.StatsRecord r) {
        if (r == null)
            throw new IllegalArgumentException("Graph record has no stats");
        Map<SymbolStatus, Integer> byStatus = new EnumMap<>(SymbolStatus.class);
        orEmpty(r.getByStatus()).forEach((k, v) -> byStatus.put(SymbolStatus.fromString(k), v));
        Map<SymbolKind, Integer> byKind = new EnumMap<>(SymbolKind.class);
        orEmpty(r.getByKind()).forEach((k, v) -> byKind.put(SymbolKind.fromString(k), v));
        List<ProjectStats.BlastRadius> blast = new ArrayList<>();
        for (GraphRecord.BlastRecord b : orEmpty(r.getAdmittedBlastRadius()))
            blast.add(new ProjectStats.BlastRadius(b.getQualifiedName(), b.getRadius()));
        return new ProjectStats(r.getTotalSymbols(), r.getFiles(), byStatus, byKind,
                new TreeMap<>(orEmpty(r.getByKeyword())), r.getTainted(), r.getUnused(),
                new TreeMap<>(orEmpty(r.getFileDependencies())), new TreeMap<>(orEmpty(r.getImports())),
                new TreeMap<>(orEmpty(r.getModuleMap())), blast);
    }

    private static List<String> sorted(Set<String> values) {
        List<String> out = new ArrayList<>(values);
        Collections.sort(out);
        return out;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }
}
