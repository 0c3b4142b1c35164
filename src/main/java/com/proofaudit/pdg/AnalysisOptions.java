package com.proofaudit.pdg;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.proofaudit.pdg.scan.UnterminatedProofPolicy;

import lombok.Data;

/**
 * Tuning knobs of one analysis run.
 *
 * Every field has a working default; a JSON file only needs to name the ones
 * it changes. Unknown keys are ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisOptions {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private FrontEnd frontEnd = FrontEnd.HEURISTIC;

    /** Worker threads for per-file scanning; 1 scans on the caller thread. */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    private UnterminatedProofPolicy unterminatedProofPolicy = UnterminatedProofPolicy.MARK_UNTERMINATED;

    /** Heuristic front-end: resolve references found inside proofs too. */
    private boolean proofBodyReferences = true;

    /** Metadata front-end: how far back to look for a statement keyword. */
    private int statementWindowBytes = 300;

    private int maxStatementLength = 2000;

    /** Metadata front-end: how far past a statement to look for its terminator. */
    private int proofScanLimitBytes = 500_000;

    public static AnalysisOptions defaults() {
        return new AnalysisOptions();
    }

    /** Reads options from a JSON file. */
    public static AnalysisOptions load(Path path) {
        try {
            return MAPPER.readValue(path.toFile(), AnalysisOptions.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load analysis options from " + path, e);
        }
    }

    public static AnalysisOptions parse(String json) {
        try {
            return MAPPER.readValue(json, AnalysisOptions.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid analysis options: " + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if a value is out of range
     */
    public AnalysisOptions validate() {
        if (frontEnd == null || unterminatedProofPolicy == null)
            throw new IllegalArgumentException("frontEnd and unterminatedProofPolicy must be set");
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism must be >= 1, was " + parallelism);
        if (statementWindowBytes < 0 || maxStatementLength < 1 || proofScanLimitBytes < 1)
            throw new IllegalArgumentException("statementWindowBytes must be >= 0, maxStatementLength and "
                    + "proofScanLimitBytes >= 1");
        return this;
    }
}
