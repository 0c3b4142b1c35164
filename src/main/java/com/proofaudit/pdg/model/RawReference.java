package com.proofaudit.pdg.model;

/**
 * An unresolved reference reported by compiler metadata.
 *
 * @param modulePath logical module the referenced name lives in
 * @param name       referenced name, possibly dotted; null when the record
 *                   names a module rather than a symbol in it
 * @param kindCode   metadata kind code of the target (def, ind, lem, ...)
 * @param range      location of the reference in the referencing file
 */
public record RawReference(String modulePath, String name, String kindCode, ByteRange range) {

    public String qualifiedName() {
        if (name == null)
            return modulePath;
        return modulePath == null || modulePath.isEmpty() ? name : modulePath + "." + name;
    }
}
