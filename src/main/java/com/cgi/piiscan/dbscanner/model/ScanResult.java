package com.cgi.piiscan.dbscanner.model;

import com.cgi.piiscan.piidetector.model.Finding;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Terminal artifact of one scan. Returned once and never mutated afterwards.
 */
@Value
@Builder
public class ScanResult {
    String scanId;

    EngineKind engine;

    ScanMode scanMode;

    Instant startedAt;

    @Singular
    List<Finding> findings;

    int tablesDiscovered;

    int tablesScanned;

    int tablesSkipped;

    long rowsAnalyzed;

    double elapsedSeconds;

    /**
     * Share of discovered tables that were sampled, 0 when nothing was discovered.
     */
    double coveragePercent;

    RiskLevel riskLevel;

    ScanStrategy strategy;

    SchemaAnalysis schemaAnalysis;

    Map<Severity, Long> findingsBySeverity;

    @Singular
    List<IntrospectionFailure> introspectionFailures;

    @Singular
    List<SkippedTable> skippedTables;

    @Singular
    List<String> warnings;
}
