package com.proofaudit.pdg.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * Flat, language-neutral form of a project graph: one record per symbol and
 * per file, plus the statistics. Field names match the in-memory model.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphRecord {
    public static final int FORMAT_VERSION = 1;

    private int formatVersion = FORMAT_VERSION;
    private List<SymbolRecord> symbols;
    private List<FileRecord> files;
    private StatsRecord stats;

    /** One symbol. Enumerations are written by constant name. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class SymbolRecord {
        private String name, qualifiedName, kind, keyword, kindCode, status, file, statement;
        private int line;
        private Integer byteStart, byteEnd;
        private List<String> dependencies, dependents, externalDependencies, taintSources;
        private boolean tainted;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class FileRecord {
        private String path, logicalModulePath;
        private List<String> imports, declaredSymbols, referencedModules;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StatsRecord {
        private int totalSymbols, files, tainted, unused;
        private Map<String, Integer> byStatus, byKind, byKeyword;
        private Map<String, List<String>> fileDependencies, imports;
        private Map<String, String> moduleMap;
        private List<BlastRecord> admittedBlastRadius;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BlastRecord {
        private String qualifiedName;
        private int radius;
    }
}
