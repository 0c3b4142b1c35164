package com.proofaudit.pdg.util;

import com.proofaudit.pdg.api.ScanListener;
import com.proofaudit.pdg.model.FileScan;

import java.util.Arrays;

/**
 * Fans callbacks out to any number of {@link ScanListener}s, in registration
 * order.
 */
public class CompositeScanListener implements ScanListener {
    private ScanListener[] listeners = new ScanListener[0];

    public void addForComposite(ScanListener listener) {
        ScanListener[] old = listeners;
        ScanListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onScanStart(int fileCount) {
        for (ScanListener l : listeners)
            l.onScanStart(fileCount);
    }

    @Override
    public void onFileScanned(int index, FileScan scan, long durationNanos) {
        for (ScanListener l : listeners)
            l.onFileScanned(index, scan, durationNanos);
    }

    @Override
    public void onFileError(int index, String path, Throwable error) {
        for (ScanListener l : listeners)
            l.onFileError(index, path, error);
    }

    @Override
    public void onScanEnd(int scanned, int failed) {
        for (ScanListener l : listeners)
            l.onScanEnd(scanned, failed);
    }
}
