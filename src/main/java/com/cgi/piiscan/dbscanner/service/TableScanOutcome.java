package com.cgi.piiscan.dbscanner.service;

import com.cgi.piiscan.dbscanner.model.SkippedTable;
import com.cgi.piiscan.piidetector.model.Finding;
import lombok.Value;

import java.util.List;

/**
 * Message a table scan hands back to the aggregating thread.
 */
@Value
public class TableScanOutcome {
    String tableName;

    /**
     * Null when the table was scanned, the skip reason otherwise.
     */
    SkippedTable.Reason skipReason;

    List<Finding> findings;

    int rowsSampled;

    long durationMillis;

    String detail;

    public static TableScanOutcome scanned(String tableName, List<Finding> findings, int rowsSampled, long durationMillis) {
        return new TableScanOutcome(tableName, null, List.copyOf(findings), rowsSampled, durationMillis, null);
    }

    public static TableScanOutcome skipped(String tableName, SkippedTable.Reason reason, long durationMillis, String detail) {
        return new TableScanOutcome(tableName, reason, List.of(), 0, durationMillis, detail);
    }

    public boolean isScanned() {
        return skipReason == null;
    }
}
