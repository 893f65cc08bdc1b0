package com.cgi.piiscan.dbscanner.service.tracking;

import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.ScanResult;
import com.cgi.piiscan.dbscanner.model.SkippedTable;

/**
 * Tracker used when no other tracker is configured.
 */
public class NoOpActivityTracker implements ActivityTracker {

    @Override
    public void scanStarted(String scanId, EngineKind engine) {
    }

    @Override
    public void tableScanned(String tableName, long durationMillis, int findingCount) {
    }

    @Override
    public void tableSkipped(String tableName, SkippedTable.Reason reason) {
    }

    @Override
    public void scanCompleted(ScanResult result) {
    }

    @Override
    public void scanFailed(String scanId, EngineKind engine, Throwable error) {
    }
}
