package com.proofaudit.pdg.api;

import com.proofaudit.pdg.model.FileScan;

/**
 * Observability interface for the per-file scanning phase.
 *
 * Callbacks fire on the thread that called the analyzer, in input order, while
 * the scan results are joined; implementations need no synchronization.
 */
public interface ScanListener {

    /**
     * Called before any file is scanned.
     *
     * @param fileCount number of source units handed to the analyzer
     */
    void onScanStart(int fileCount);

    /**
     * Called once per successfully scanned file.
     *
     * @param index         position of the file in the input
     * @param scan          what was recovered
     * @param durationNanos time spent scanning this file
     */
    void onFileScanned(int index, FileScan scan, long durationNanos);

    /**
     * Called when a file is skipped because its scan failed.
     *
     * @param index position of the file in the input
     * @param path  relative path of the file
     * @param error the cause
     */
    void onFileError(int index, String path, Throwable error);

    /**
     * Called after every file has been joined.
     *
     * @param scanned number of files scanned successfully
     * @param failed  number of files skipped
     */
    void onScanEnd(int scanned, int failed);
}
