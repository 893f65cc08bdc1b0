package com.cgi.piiscan.dbscanner.service;

import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.IntrospectionFailure;
import com.cgi.piiscan.dbscanner.model.IntrospectionResult;
import com.cgi.piiscan.dbscanner.model.RiskLevel;
import com.cgi.piiscan.dbscanner.model.ScanMode;
import com.cgi.piiscan.dbscanner.model.ScanResult;
import com.cgi.piiscan.dbscanner.model.ScanStats;
import com.cgi.piiscan.dbscanner.model.ScanStrategy;
import com.cgi.piiscan.dbscanner.model.SchemaAnalysis;
import com.cgi.piiscan.dbscanner.model.SkippedTable;
import com.cgi.piiscan.piidetector.model.Finding;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the final scan result from the outputs of every scan phase.
 */
@Component
public class ScanResultAggregator {

    /**
     * Identity and start time of one scan.
     */
    @Value
    public static class ScanHeader {
        String scanId;
        EngineKind engine;
        ScanMode scanMode;
        Instant startedAt;
    }

    /**
     * Aggregates a completed scan.
     *
     * @param header Scan identity
     * @param introspection Introspection outcome, including failures
     * @param analysis Schema analysis
     * @param strategy Selected strategy
     * @param report Parallel phase report
     * @param elapsed Total scan duration
     * @return Scan result
     */
    public ScanResult aggregate(ScanHeader header, IntrospectionResult introspection, SchemaAnalysis analysis,
                                ScanStrategy strategy, ParallelScanReport report, Duration elapsed) {
        ScanStats stats = report.getStats();
        int discovered = analysis.getTotalTables();

        ScanResult.ScanResultBuilder builder = base(header, elapsed)
                .findings(report.getFindings())
                .tablesDiscovered(discovered)
                .tablesScanned(stats.getTablesScanned())
                .tablesSkipped(stats.getTablesSkipped())
                .rowsAnalyzed(stats.getRowsAnalyzed())
                .coveragePercent(coveragePercent(stats.getTablesScanned(), discovered))
                .riskLevel(analysis.getRiskLevel())
                .strategy(strategy)
                .schemaAnalysis(analysis)
                .findingsBySeverity(countBySeverity(report.getFindings()))
                .introspectionFailures(introspection.getFailures())
                .skippedTables(stats.getSkippedTables());

        for (IntrospectionFailure failure : introspection.getFailures()) {
            builder.warning("Table " + failure.getTableName() + " could not be introspected: " + failure.getReason());
        }
        for (SkippedTable skipped : stats.getSkippedTables()) {
            builder.warning("Table " + skipped.getTableName() + " skipped (" + skipped.getReason() + "): " + skipped.getDetail());
        }
        if (stats.isBudgetExhausted()) {
            builder.warning("Scan time budget of " + strategy.getMaxScanTime().toSeconds()
                    + "s exhausted; result is partial");
        }
        return builder.build();
    }

    /**
     * Builds the result of a scan that found nothing to sample.
     *
     * @param header Scan identity
     * @param introspection Introspection outcome, possibly empty
     * @param elapsed Total scan duration
     * @param warning Why nothing was scanned
     * @return Empty scan result
     */
    public ScanResult empty(ScanHeader header, IntrospectionResult introspection, Duration elapsed, String warning) {
        return base(header, elapsed)
                .findings(List.of())
                .riskLevel(RiskLevel.LOW)
                .findingsBySeverity(countBySeverity(List.of()))
                .introspectionFailures(introspection.getFailures())
                .warning(warning)
                .build();
    }

    private static ScanResult.ScanResultBuilder base(ScanHeader header, Duration elapsed) {
        return ScanResult.builder()
                .scanId(header.getScanId())
                .engine(header.getEngine())
                .scanMode(header.getScanMode())
                .startedAt(header.getStartedAt())
                .elapsedSeconds(elapsed.toMillis() / 1000.0);
    }

    /**
     * Share of discovered tables that were scanned.
     *
     * @param scanned Tables scanned
     * @param discovered Tables discovered
     * @return Percentage, 0 when nothing was discovered
     */
    static double coveragePercent(int scanned, int discovered) {
        if (discovered == 0) {
            return 0.0;
        }
        return 100.0 * scanned / discovered;
    }

    private static Map<Severity, Long> countBySeverity(List<Finding> findings) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (Finding finding : findings) {
            counts.merge(finding.getSeverity(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
