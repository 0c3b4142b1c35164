package com.proofaudit.pdg.model;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One input file handed to the analyzer: the raw source bytes, its path
 * relative to the project root, and optionally the compiler metadata that
 * belongs to it.
 *
 * @param path              relative path, used as the file identity in the graph
 * @param source            raw bytes of the {@code .v} file
 * @param metadata          text of the matching {@code .glob} file, or null
 * @param logicalModulePath logical module path for the heuristic front-end, or
 *                          null. The metadata front-end reads it from the
 *                          metadata instead.
 */
public record SourceUnit(String path, byte[] source, String metadata, String logicalModulePath) {

    public SourceUnit {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(source, "source");
    }

    public static SourceUnit of(String path, String source) {
        return new SourceUnit(path, source.getBytes(StandardCharsets.UTF_8), null, null);
    }

    public static SourceUnit withMetadata(String path, String source, String metadata) {
        return new SourceUnit(path, source.getBytes(StandardCharsets.UTF_8), metadata, null);
    }

    public boolean hasMetadata() {
        return metadata != null;
    }

    /** Source decoded as UTF-8, malformed sequences replaced. */
    public String sourceText() {
        return new String(source, StandardCharsets.UTF_8);
    }

    /**
     * Reads a source file and, if it exists next to it, its {@code .glob}
     * companion. Does not walk directories; callers enumerate files.
     *
     * @param root project root, used to relativize the path
     * @param file the {@code .v} file
     */
    public static SourceUnit load(Path root, Path file) {
        String fileName = file.getFileName().toString();
        String base = fileName.endsWith(".v") ? fileName.substring(0, fileName.length() - 2) : fileName;
        Path glob = file.resolveSibling(base + ".glob");
        return load(root, file, Files.isRegularFile(glob) ? glob : null);
    }

    /**
     * Reads a source file together with an explicitly located metadata file,
     * for builds that put {@code .glob} files in a separate directory.
     */
    public static SourceUnit load(Path root, Path file, Path metadataFile) {
        String rel = root.relativize(file).toString().replace('\\', '/');
        try {
            byte[] bytes = Files.readAllBytes(file);
            String metadata = metadataFile != null ? Files.readString(metadataFile, StandardCharsets.UTF_8) : null;
            return new SourceUnit(rel, bytes, metadata, null);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public SourceUnit withLogicalModulePath(String modulePath) {
        return new SourceUnit(path, source, metadata, modulePath);
    }
}
