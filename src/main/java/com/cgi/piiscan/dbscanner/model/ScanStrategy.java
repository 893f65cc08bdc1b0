package com.cgi.piiscan.dbscanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * The sampling plan chosen for one scan.
 */
@Value
@Builder
public class ScanStrategy {
    StrategyKind kind;

    /**
     * Number of tables to scan, never more than the tables discovered.
     */
    int targetTables;

    /**
     * Rows sampled from each table.
     */
    int sampleSize;

    /**
     * Table scans allowed in flight at once.
     */
    int workers;

    /**
     * Wall-clock budget for the parallel phase.
     */
    Duration maxScanTime;

    /**
     * Why this strategy was picked.
     */
    String reasoning;
}
