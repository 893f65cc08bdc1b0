package com.cgi.piiscan.dbscanner.service;

import com.cgi.piiscan.dbscanner.core.connector.DatabaseConnectorRegistry;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.exception.SamplingException;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.DataSample;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.IntrospectionResult;
import com.cgi.piiscan.dbscanner.model.ScanStrategy;
import com.cgi.piiscan.dbscanner.model.SkippedTable;
import com.cgi.piiscan.dbscanner.model.StrategyKind;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import com.cgi.piiscan.dbscanner.service.tracking.NoOpActivityTracker;
import com.cgi.piiscan.piidetector.detector.EmailDetector;
import com.cgi.piiscan.piidetector.model.Finding;
import com.cgi.piiscan.piidetector.service.DetectorSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ParallelScanEngineTest {
    private static final ConnectionParameters PARAMS = ConnectionParameters.builder()
            .engine(EngineKind.POSTGRESQL)
            .host("localhost")
            .database("crm")
            .build();

    private StubScanner scanner;
    private DatabaseConnectorRegistry registry;
    private ParallelScanEngine engine;

    @BeforeEach
    void setUp() {
        scanner = new StubScanner();
        registry = mock(DatabaseConnectorRegistry.class);
        when(registry.open(any(ConnectionParameters.class), anyInt())).thenReturn(scanner);
        engine = new ParallelScanEngine(registry, new DetectorSet(List.of(new EmailDetector())),
                Duration.ofMillis(300), new NoOpActivityTracker());
    }

    private static TableDescriptor table(String name) {
        return TableDescriptor.builder().name(name).estimatedRowCount(10).build();
    }

    private static ScanStrategy strategy(int workers, Duration budget) {
        return ScanStrategy.builder()
                .kind(StrategyKind.COMPREHENSIVE)
                .targetTables(10)
                .sampleSize(100)
                .workers(workers)
                .maxScanTime(budget)
                .reasoning("test")
                .build();
    }

    @Test
    void scansAllTablesAndCollectsLocatedFindings() {
        // Given
        List<TableDescriptor> tables = List.of(table("customers"), table("orders"), table("invoices"));

        // When
        ParallelScanReport report = engine.scan(tables, PARAMS, strategy(2, Duration.ofSeconds(30)), ProgressSink.none());

        // Then
        assertThat(report.getStats().getTablesScanned()).isEqualTo(3);
        assertThat(report.getStats().getTablesSkipped()).isZero();
        assertThat(report.getStats().getRowsAnalyzed()).isEqualTo(6);
        assertThat(report.getFindings()).hasSize(6)
                .extracting(Finding::getTableName)
                .containsOnly("customers", "orders", "invoices");
        assertThat(report.getFindings()).extracting(Finding::getColumnName).containsOnly("email");
        verify(registry).open(PARAMS, 2);
        assertThat(scanner.closed).isTrue();
    }

    @Test
    void hangingTableIsSkippedAfterTimeoutWhileOthersComplete() {
        // Given
        scanner.hanging.add("audit_log");
        List<TableDescriptor> tables = List.of(table("audit_log"), table("customers"), table("orders"));

        // When
        ParallelScanReport report = engine.scan(tables, PARAMS, strategy(2, Duration.ofSeconds(30)), ProgressSink.none());

        // Then
        assertThat(report.getStats().getTablesScanned()).isEqualTo(2);
        assertThat(report.getStats().getTablesSkipped()).isEqualTo(1);
        assertThat(report.getStats().getSkippedTables()).singleElement().satisfies(skipped -> {
            assertThat(skipped.getTableName()).isEqualTo("audit_log");
            assertThat(skipped.getReason()).isEqualTo(SkippedTable.Reason.TIMEOUT);
        });
        assertThat(report.getFindings()).extracting(Finding::getTableName).doesNotContain("audit_log");
    }

    @Test
    void failingTableIsReportedAsError() {
        // Given
        scanner.failing.add("broken");

        // When
        ParallelScanReport report = engine.scan(List.of(table("broken"), table("customers")), PARAMS,
                strategy(2, Duration.ofSeconds(30)), ProgressSink.none());

        // Then
        assertThat(report.getStats().getTablesScanned()).isEqualTo(1);
        assertThat(report.getStats().getSkippedTables()).singleElement().satisfies(skipped -> {
            assertThat(skipped.getReason()).isEqualTo(SkippedTable.Reason.ERROR);
            assertThat(skipped.getDetail()).contains("permission denied");
        });
    }

    @Test
    void exhaustedBudgetStopsDispatching() {
        // Given
        List<TableDescriptor> tables = List.of(table("a"), table("b"), table("c"));

        // When
        ParallelScanReport report = engine.scan(tables, PARAMS, strategy(2, Duration.ZERO), ProgressSink.none());

        // Then
        assertThat(report.getStats().isBudgetExhausted()).isTrue();
        assertThat(report.getStats().getTablesScanned()).isZero();
        assertThat(report.getStats().getSkippedTables())
                .extracting(SkippedTable::getReason)
                .containsOnly(SkippedTable.Reason.BUDGET_EXHAUSTED);
        assertThat(scanner.sampled).isEmpty();
    }

    @Test
    void budgetSpentDuringScanLeavesRemainingTablesUnscanned() {
        // Given
        scanner.delays.put("slow", 250L);
        List<TableDescriptor> tables = List.of(table("slow"), table("b"), table("c"));

        // When
        ParallelScanReport report = engine.scan(tables, PARAMS, strategy(1, Duration.ofMillis(100)), ProgressSink.none());

        // Then
        assertThat(report.getStats().getTablesScanned()).isEqualTo(1);
        assertThat(report.getStats().getTablesSkipped()).isEqualTo(2);
        assertThat(report.getStats().isBudgetExhausted()).isTrue();
        assertThat(scanner.sampled).containsExactly("slow");
    }

    @Test
    void progressIsMonotonicAndCoversEveryTable() {
        // Given
        scanner.failing.add("t2");
        List<TableDescriptor> tables = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            tables.add(table("t" + i));
        }
        List<int[]> calls = new CopyOnWriteArrayList<>();

        // When
        engine.scan(tables, PARAMS, strategy(3, Duration.ofSeconds(30)),
                (completed, total, message) -> calls.add(new int[]{completed, total}));

        // Then
        assertThat(calls).hasSize(6);
        for (int i = 0; i < calls.size(); i++) {
            assertThat(calls.get(i)[0]).isEqualTo(i + 1);
            assertThat(calls.get(i)[1]).isEqualTo(6);
        }
    }

    @Test
    void throwingProgressSinkDoesNotAbortScan() {
        // When
        ParallelScanReport report = engine.scan(List.of(table("a"), table("b")), PARAMS,
                strategy(2, Duration.ofSeconds(30)), (completed, total, message) -> {
                    throw new IllegalStateException("ui gone");
                });

        // Then
        assertThat(report.getStats().getTablesScanned()).isEqualTo(2);
    }

    @Test
    void concurrentTasksNeverExceedWorkerCount() {
        // Given
        for (int i = 0; i < 8; i++) {
            scanner.delays.put("t" + i, 30L);
        }
        List<TableDescriptor> tables = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            tables.add(table("t" + i));
        }

        // When
        ParallelScanReport report = engine.scan(tables, PARAMS, strategy(2, Duration.ofSeconds(30)), ProgressSink.none());

        // Then
        assertThat(report.getStats().getTablesScanned()).isEqualTo(8);
        assertThat(scanner.maxConcurrent.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void emptyTableListOpensNoConnection() {
        ParallelScanReport report = engine.scan(List.of(), PARAMS, strategy(2, Duration.ofSeconds(30)), ProgressSink.none());

        assertThat(report.getFindings()).isEmpty();
        assertThat(report.getStats().getTablesScanned()).isZero();
        verify(registry, never()).open(eq(PARAMS), anyInt());
    }

    @Test
    void timedOutTableStillReportsProgressAndClosesScanner() {
        AtomicBoolean done = new AtomicBoolean();
        scanner.hanging.add("x");

        engine.scan(List.of(table("x")), PARAMS, strategy(1, Duration.ofSeconds(30)),
                (completed, total, message) -> done.set(true));

        assertThat(done).isTrue();
        assertThat(scanner.closed).isTrue();
    }

    @Test
    void interruptedScanRecordsEveryUnfinishedTable() throws Exception {
        // Given
        ParallelScanEngine patientEngine = new ParallelScanEngine(registry,
                new DetectorSet(List.of(new EmailDetector())), Duration.ofSeconds(30), new NoOpActivityTracker());
        scanner.hanging.add("a");
        scanner.hanging.add("b");
        List<TableDescriptor> tables = List.of(table("a"), table("b"), table("c"));
        AtomicReference<ParallelScanReport> result = new AtomicReference<>();
        Thread scanThread = new Thread(() -> result.set(patientEngine.scan(tables, PARAMS,
                strategy(2, Duration.ofSeconds(30)), ProgressSink.none())));

        // When
        scanThread.start();
        long waitUntil = System.currentTimeMillis() + 5_000;
        while (scanner.sampled.size() < 2 && System.currentTimeMillis() < waitUntil) {
            Thread.sleep(10);
        }
        scanThread.interrupt();
        scanThread.join(10_000);

        // Then
        ParallelScanReport report = result.get();
        assertThat(report).isNotNull();
        assertThat(report.getStats().getTablesScanned()).isZero();
        assertThat(report.getStats().getTablesSkipped()).isEqualTo(3);
        assertThat(report.getStats().getSkippedTables())
                .hasSize(3)
                .extracting(SkippedTable::getTableName)
                .containsExactlyInAnyOrder("a", "b", "c");
        assertThat(report.getStats().getSkippedTables())
                .extracting(SkippedTable::getReason)
                .containsOnly(SkippedTable.Reason.INTERRUPTED);
        assertThat(scanner.closed).isTrue();
    }

    /**
     * Returns two rows with an email address per table, unless told to hang, fail or slow down.
     */
    private static class StubScanner implements DatabaseScanner {
        final List<String> hanging = new CopyOnWriteArrayList<>();
        final List<String> failing = new CopyOnWriteArrayList<>();
        final Map<String, Long> delays = new ConcurrentHashMap<>();
        final List<String> sampled = new CopyOnWriteArrayList<>();
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger maxConcurrent = new AtomicInteger();
        volatile boolean closed;

        @Override
        public EngineKind getEngineKind() {
            return EngineKind.POSTGRESQL;
        }

        @Override
        public IntrospectionResult scanTables() {
            return IntrospectionResult.empty();
        }

        @Override
        public DataSample sampleTableData(TableDescriptor table, int limit) {
            String name = table.getName();
            sampled.add(name);
            int now = running.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                if (failing.contains(name)) {
                    throw new SamplingException("permission denied for " + name);
                }
                if (hanging.contains(name)) {
                    sleep(60_000);
                }
                Long delay = delays.get(name);
                if (delay != null) {
                    sleep(delay);
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                rows.add(row(1, "jan@example.nl"));
                rows.add(row(2, "piet@example.nl"));
                return DataSample.fromRows(name, rows);
            } finally {
                running.decrementAndGet();
            }
        }

        private static Map<String, Object> row(int id, String email) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", id);
            row.put("email", email);
            return row;
        }

        private static void sleep(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SamplingException("interrupted", e);
            }
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
