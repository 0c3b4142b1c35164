package com.proofaudit.pdg.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Aggregate figures over a frozen project graph.
 *
 * @param totalSymbols        number of symbols
 * @param files               number of files that were scanned successfully
 * @param byStatus            symbol count per status; every status is present
 * @param byKind              symbol count per kind group
 * @param byKeyword           symbol count per display keyword
 * @param tainted             number of tainted symbols
 * @param unused              number of symbols without dependents
 * @param fileDependencies    file path to the other files it depends on
 * @param imports             file path to its import statements
 * @param moduleMap           logical module path to file path
 * @param admittedBlastRadius every admitted symbol with its blast radius,
 *                            largest first
 */
public record ProjectStats(
        int totalSymbols,
        int files,
        Map<SymbolStatus, Integer> byStatus,
        Map<SymbolKind, Integer> byKind,
        SortedMap<String, Integer> byKeyword,
        int tainted,
        int unused,
        SortedMap<String, List<String>> fileDependencies,
        SortedMap<String, List<String>> imports,
        SortedMap<String, String> moduleMap,
        List<BlastRadius> admittedBlastRadius) {

    public ProjectStats {
        EnumMap<SymbolStatus, Integer> statuses = new EnumMap<>(SymbolStatus.class);
        for (SymbolStatus s : SymbolStatus.values())
            statuses.put(s, 0);
        statuses.putAll(byStatus);
        byStatus = Collections.unmodifiableMap(statuses);
        EnumMap<SymbolKind, Integer> kinds = new EnumMap<>(SymbolKind.class);
        kinds.putAll(byKind);
        byKind = Collections.unmodifiableMap(kinds);
        byKeyword = Collections.unmodifiableSortedMap(new TreeMap<>(byKeyword));
        fileDependencies = Collections.unmodifiableSortedMap(copyLists(fileDependencies));
        imports = Collections.unmodifiableSortedMap(copyLists(imports));
        moduleMap = Collections.unmodifiableSortedMap(new TreeMap<>(moduleMap));
        admittedBlastRadius = List.copyOf(admittedBlastRadius);
    }

    public int count(SymbolStatus status) {
        return byStatus.get(status);
    }

    private static TreeMap<String, List<String>> copyLists(Map<String, List<String>> source) {
        TreeMap<String, List<String>> copy = new TreeMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return copy;
    }

    /** One entry of the blast-radius ranking. */
    public record BlastRadius(String qualifiedName, int radius) {
    }
}
