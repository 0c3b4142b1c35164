package com.proofaudit.pdg.model;

import java.util.List;
import java.util.Set;

/**
 * A scanned file and its file-level facts.
 *
 * @param path              relative path
 * @param logicalModulePath logical module path, or null when unknown
 * @param imports           modules named by Require/Import statements, in
 *                          source order
 * @param declaredSymbols   qualified names declared in this file
 * @param referencedModules other modules referenced anywhere in the file;
 *                          only the metadata front-end fills this
 */
public record SourceFile(String path, String logicalModulePath, List<String> imports,
        Set<String> declaredSymbols, Set<String> referencedModules) {

    public SourceFile {
        imports = List.copyOf(imports);
        declaredSymbols = Set.copyOf(declaredSymbols);
        referencedModules = Set.copyOf(referencedModules);
    }
}
