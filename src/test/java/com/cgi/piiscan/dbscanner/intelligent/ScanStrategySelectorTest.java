package com.cgi.piiscan.dbscanner.intelligent;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.model.RiskLevel;
import com.cgi.piiscan.dbscanner.model.ScanMode;
import com.cgi.piiscan.dbscanner.model.ScanStrategy;
import com.cgi.piiscan.dbscanner.model.SchemaAnalysis;
import com.cgi.piiscan.dbscanner.model.StrategyKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanStrategySelectorTest {

    private ScanStrategySelector selector;

    @BeforeEach
    void setUp() {
        ScannerProperties properties = new ScannerProperties();
        properties.setMaxScanTime(Duration.ofSeconds(120));
        selector = new ScanStrategySelector(properties);
    }

    private static SchemaAnalysis analysis(int tables, long rows, RiskLevel risk) {
        return SchemaAnalysis.builder()
                .totalTables(tables)
                .estimatedRows(rows)
                .riskLevel(risk)
                .build();
    }

    private static void assertStrategy(ScanStrategy strategy, StrategyKind kind, int targetTables,
                                       int sampleSize, int workers) {
        assertThat(strategy.getKind()).isEqualTo(kind);
        assertThat(strategy.getTargetTables()).isEqualTo(targetTables);
        assertThat(strategy.getSampleSize()).isEqualTo(sampleSize);
        assertThat(strategy.getWorkers()).isEqualTo(workers);
    }

    @Test
    void smallSchemaIsScannedComprehensively() {
        // When
        ScanStrategy strategy = selector.select(analysis(9, 1_000, RiskLevel.LOW), ScanMode.SMART, null);

        // Then
        assertStrategy(strategy, StrategyKind.COMPREHENSIVE, 9, 100, 2);
        assertThat(strategy.getMaxScanTime()).isEqualTo(Duration.ofSeconds(120));
        assertThat(strategy.getReasoning()).isEqualTo("Selected comprehensive for 9 tables with 1000 total rows");
    }

    @Test
    void smallSchemaWinsOverHighRisk() {
        ScanStrategy strategy = selector.select(analysis(8, 50, RiskLevel.HIGH), ScanMode.SMART, null);

        assertStrategy(strategy, StrategyKind.COMPREHENSIVE, 8, 100, 2);
    }

    @Test
    void fastModeCapsAtFifteenTablesAndIgnoresMaxTables() {
        ScanStrategy strategy = selector.select(analysis(200, 5_000_000, RiskLevel.HIGH), ScanMode.FAST, 40);

        assertStrategy(strategy, StrategyKind.COMPREHENSIVE, 15, 100, 2);
    }

    @Test
    void deepModeUsesPriorityDeep() {
        assertStrategy(selector.select(analysis(200, 10, RiskLevel.LOW), ScanMode.DEEP, null),
                StrategyKind.PRIORITY_DEEP, 75, 500, 3);
        assertStrategy(selector.select(analysis(30, 10, RiskLevel.LOW), ScanMode.DEEP, null),
                StrategyKind.PRIORITY_DEEP, 30, 500, 3);
        assertStrategy(selector.select(analysis(200, 10, RiskLevel.LOW), ScanMode.DEEP, 20),
                StrategyKind.PRIORITY_DEEP, 20, 500, 3);
    }

    @Test
    void highRiskSmartScanGoesDeep() {
        assertStrategy(selector.select(analysis(120, 10, RiskLevel.HIGH), ScanMode.SMART, null),
                StrategyKind.PRIORITY_DEEP, 75, 500, 3);
    }

    @Test
    void largeSchemaIsSampled() {
        assertStrategy(selector.select(analysis(20, 100_001, RiskLevel.MEDIUM), ScanMode.SMART, null),
                StrategyKind.SAMPLING, 20, 200, 3);
        assertStrategy(selector.select(analysis(101, 10, RiskLevel.LOW), ScanMode.SMART, null),
                StrategyKind.SAMPLING, 40, 200, 3);
        assertStrategy(selector.select(analysis(101, 10, RiskLevel.LOW), ScanMode.SMART, 60),
                StrategyKind.SAMPLING, 60, 200, 3);
    }

    @Test
    void mediumSizedSchemaUsesPriority() {
        assertStrategy(selector.select(analysis(60, 100_000, RiskLevel.MEDIUM), ScanMode.SMART, null),
                StrategyKind.PRIORITY, 50, 300, 3);
        assertStrategy(selector.select(analysis(60, 1_000, RiskLevel.LOW), ScanMode.SMART, 10),
                StrategyKind.PRIORITY, 10, 300, 3);
    }

    @Test
    void remainingSchemasAreScannedComprehensivelyWithoutCap() {
        assertStrategy(selector.select(analysis(50, 1_000, RiskLevel.LOW), ScanMode.SMART, 5),
                StrategyKind.COMPREHENSIVE, 50, 500, 2);
    }

    @Test
    void targetNeverExceedsDiscoveredTables() {
        ScanStrategy strategy = selector.select(analysis(101, 10, RiskLevel.LOW), ScanMode.SMART, 500);

        assertThat(strategy.getTargetTables()).isEqualTo(101);
    }

    @Test
    void selectionIsDeterministic() {
        SchemaAnalysis analysis = analysis(77, 250_000, RiskLevel.MEDIUM);

        assertThat(selector.select(analysis, ScanMode.SMART, 33))
                .isEqualTo(selector.select(analysis, ScanMode.SMART, 33));
    }

    @Test
    void rejectsNonPositiveMaxTables() {
        SchemaAnalysis analysis = analysis(30, 10, RiskLevel.LOW);

        assertThatThrownBy(() -> selector.select(analysis, ScanMode.SMART, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.select(analysis, ScanMode.SMART, -3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
