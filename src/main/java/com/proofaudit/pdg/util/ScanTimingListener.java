package com.proofaudit.pdg.util;

import com.proofaudit.pdg.api.ScanListener;
import com.proofaudit.pdg.model.FileScan;

/**
 * Tracks how long the scanning phase and each file took.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Wall time:</b> from {@code onScanStart} to {@code onScanEnd}.</li>
 * <li><b>Per file:</b> min, max and average scan time, and the slowest
 * file.</li>
 * <li><b>Outcome:</b> files scanned, files failed, declarations found.</li>
 * </ul>
 * Per-file times are measured on the worker threads, so with parallel scanning
 * their sum exceeds the wall time.
 */
public final class ScanTimingListener implements ScanListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(ScanTimingListener.class);

    private long scanStartNanos, wallNanos;
    private long filesScanned, filesFailed, declarations;
    private long totalFileNanos;
    private long minFileNanos = Long.MAX_VALUE, maxFileNanos = Long.MIN_VALUE;
    private String slowestFile;

    @Override
    public void onScanStart(int fileCount) {
        scanStartNanos = System.nanoTime();
    }

    @Override
    public void onFileScanned(int index, FileScan scan, long durationNanos) {
        filesScanned++;
        declarations += scan.declarations().size();
        totalFileNanos += durationNanos;
        if (durationNanos < minFileNanos)
            minFileNanos = durationNanos;
        if (durationNanos > maxFileNanos) {
            maxFileNanos = durationNanos;
            slowestFile = scan.file().path();
        }
    }

    @Override
    public void onFileError(int index, String path, Throwable error) {
        filesFailed++;
    }

    @Override
    public void onScanEnd(int scanned, int failed) {
        wallNanos = System.nanoTime() - scanStartNanos;
        log.debug("Scan took {} ms for {} files", wallNanos / 1_000_000, scanned + failed);
    }

    public long filesScanned() {
        return filesScanned;
    }

    public long filesFailed() {
        return filesFailed;
    }

    public long declarations() {
        return declarations;
    }

    public long wallNanos() {
        return wallNanos;
    }

    public double avgFileMicros() {
        return filesScanned > 0 ? totalFileNanos / 1000.0 / filesScanned : 0;
    }

    public long minFileNanos() {
        return minFileNanos == Long.MAX_VALUE ? 0 : minFileNanos;
    }

    public long maxFileNanos() {
        return maxFileNanos == Long.MIN_VALUE ? 0 : maxFileNanos;
    }

    /** Path of the slowest successfully scanned file, or null before any. */
    public String slowestFile() {
        return slowestFile;
    }

    public void reset() {
        scanStartNanos = 0;
        wallNanos = 0;
        filesScanned = 0;
        filesFailed = 0;
        declarations = 0;
        totalFileNanos = 0;
        minFileNanos = Long.MAX_VALUE;
        maxFileNanos = Long.MIN_VALUE;
        slowestFile = null;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s\n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f\n", "Files scanned", filesScanned,
                avgFileMicros(), minFileNanos() / 1000.0, maxFileNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d |\n", "Files failed", filesFailed));
        sb.append(String.format("%-20s | %10d |\n", "Declarations", declarations));
        sb.append(String.format("%-20s | %10.2f |\n", "Wall time (ms)", wallNanos / 1_000_000.0));
        if (slowestFile != null)
            sb.append("Slowest file: ").append(slowestFile).append('\n');
        return sb.toString();
    }
}
