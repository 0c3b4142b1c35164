package com.proofaudit.pdg.glob;

import com.proofaudit.pdg.model.ByteRange;

/**
 * A definition record: {@code <kind> <start>:<end> <secpath> <name>}.
 *
 * @param kindCode raw kind code
 * @param range    byte extent of the name in the source file
 * @param secPath  section path qualifying the name, or null for {@code <>}
 * @param name     cleaned name (binder suffix removed)
 */
public record GlobDefinition(String kindCode, ByteRange range, String secPath, String name) {

    /** Name relative to the file's module: section path and name. */
    public String localName() {
        return secPath == null ? name : secPath + "." + name;
    }

    public String qualifiedIn(String logicalPath) {
        return logicalPath == null || logicalPath.isEmpty() ? localName() : logicalPath + "." + localName();
    }

    /** Notation artefacts carry names that are not identifiers. */
    public boolean isNotationArtefact() {
        return name.startsWith("::") || name.startsWith("'");
    }
}
