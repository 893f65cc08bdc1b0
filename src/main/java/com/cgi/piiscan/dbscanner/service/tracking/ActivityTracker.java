package com.cgi.piiscan.dbscanner.service.tracking;

import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.ScanResult;
import com.cgi.piiscan.dbscanner.model.SkippedTable;

/**
 * Receives scan lifecycle events. Implementations must be thread-safe and must not throw.
 */
public interface ActivityTracker {

    void scanStarted(String scanId, EngineKind engine);

    void tableScanned(String tableName, long durationMillis, int findingCount);

    void tableSkipped(String tableName, SkippedTable.Reason reason);

    void scanCompleted(ScanResult result);

    void scanFailed(String scanId, EngineKind engine, Throwable error);
}
