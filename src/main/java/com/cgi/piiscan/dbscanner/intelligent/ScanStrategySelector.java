/*
 * ScanStrategySelector.java - Decision tree picking the sampling plan of a scan
 */
package com.cgi.piiscan.dbscanner.intelligent;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.model.RiskLevel;
import com.cgi.piiscan.dbscanner.model.ScanMode;
import com.cgi.piiscan.dbscanner.model.ScanStrategy;
import com.cgi.piiscan.dbscanner.model.SchemaAnalysis;
import com.cgi.piiscan.dbscanner.model.StrategyKind;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Selects a scan strategy from the schema analysis and the requested mode.
 * Rules are evaluated in a fixed order and the first match wins; small schemas are
 * always scanned comprehensively, even when flagged high risk.
 */
@Component
public class ScanStrategySelector {
    static final int SMALL_SCHEMA_TABLES = 10;
    static final int FAST_MAX_TABLES = 15;
    static final int DEEP_DEFAULT_TABLES = 75;
    static final int SAMPLING_DEFAULT_TABLES = 40;
    static final int PRIORITY_DEFAULT_TABLES = 50;
    static final long LARGE_SCHEMA_ROWS = 100_000;
    static final int LARGE_SCHEMA_TABLES = 100;

    private final Duration maxScanTime;

    public ScanStrategySelector(ScannerProperties properties) {
        this.maxScanTime = properties.getMaxScanTime();
    }

    /**
     * Selects the strategy.
     *
     * @param analysis Schema analysis
     * @param mode Scan mode
     * @param maxTables Caller cap on scanned tables, or null
     * @return Strategy
     * @throws IllegalArgumentException If maxTables is not positive
     */
    public ScanStrategy select(SchemaAnalysis analysis, ScanMode mode, Integer maxTables) {
        if (maxTables != null && maxTables <= 0) {
            throw new IllegalArgumentException("maxTables must be positive: " + maxTables);
        }

        int total = analysis.getTotalTables();
        long rows = analysis.getEstimatedRows();

        if (mode == ScanMode.FAST || total <= SMALL_SCHEMA_TABLES) {
            return strategy(StrategyKind.COMPREHENSIVE, Math.min(total, FAST_MAX_TABLES), 100, 2, total, rows);
        }
        if (mode == ScanMode.DEEP || analysis.getRiskLevel() == RiskLevel.HIGH) {
            return strategy(StrategyKind.PRIORITY_DEEP, capped(maxTables, DEEP_DEFAULT_TABLES, total), 500, 3, total, rows);
        }
        if (rows > LARGE_SCHEMA_ROWS || total > LARGE_SCHEMA_TABLES) {
            return strategy(StrategyKind.SAMPLING, capped(maxTables, SAMPLING_DEFAULT_TABLES, total), 200, 3, total, rows);
        }
        if (total > PRIORITY_DEFAULT_TABLES) {
            return strategy(StrategyKind.PRIORITY, capped(maxTables, PRIORITY_DEFAULT_TABLES, total), 300, 3, total, rows);
        }
        return strategy(StrategyKind.COMPREHENSIVE, total, 500, 2, total, rows);
    }

    private static int capped(Integer maxTables, int defaultTables, int total) {
        return Math.min(maxTables != null ? maxTables : defaultTables, total);
    }

    private ScanStrategy strategy(StrategyKind kind, int targetTables, int sampleSize, int workers,
                                  int total, long rows) {
        return ScanStrategy.builder()
                .kind(kind)
                .targetTables(targetTables)
                .sampleSize(sampleSize)
                .workers(workers)
                .maxScanTime(maxScanTime)
                .reasoning(String.format("Selected %s for %d tables with %d total rows",
                        kind.name().toLowerCase(), total, rows))
                .build();
    }
}
