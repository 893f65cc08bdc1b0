package com.cgi.piiscan.dbscanner.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Counters produced by the parallel scan phase.
 */
@Value
@Builder
public class ScanStats {
    int tablesScanned;

    int tablesSkipped;

    long rowsAnalyzed;

    Duration elapsed;

    /**
     * Set when the wall-clock budget stopped dispatching.
     */
    boolean budgetExhausted;

    @Singular
    List<SkippedTable> skippedTables;
}
