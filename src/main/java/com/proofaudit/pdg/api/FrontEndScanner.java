package com.proofaudit.pdg.api;

import com.proofaudit.pdg.model.FileScan;
import com.proofaudit.pdg.model.SourceUnit;

/**
 * A strategy that recovers declarations from one source file.
 *
 * Implementations must depend only on the unit they are given and hold no
 * mutable state between calls: the analyzer invokes {@link #scan(SourceUnit)}
 * concurrently for different files.
 */
public interface FrontEndScanner {

    /**
     * Scans one file.
     *
     * @param unit the file to scan
     * @return the declarations found, not yet resolved against other files
     * @throws RuntimeException if the file cannot be scanned; the analyzer
     *                          skips the file and continues with the others
     */
    FileScan scan(SourceUnit unit);

    /** Whether this front-end can do anything with the given unit. */
    default boolean accepts(SourceUnit unit) {
        return true;
    }
}
