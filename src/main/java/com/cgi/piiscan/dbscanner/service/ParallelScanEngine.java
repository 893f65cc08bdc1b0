package com.cgi.piiscan.dbscanner.service;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseConnectorRegistry;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.ScanStats;
import com.cgi.piiscan.dbscanner.model.ScanStrategy;
import com.cgi.piiscan.dbscanner.model.SkippedTable;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import com.cgi.piiscan.dbscanner.service.tracking.ActivityTracker;
import com.cgi.piiscan.dbscanner.service.tracking.NoOpActivityTracker;
import com.cgi.piiscan.piidetector.model.Finding;
import com.cgi.piiscan.piidetector.service.DetectorSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Samples the selected tables with a bounded number of workers.
 * <p>
 * Workers never touch shared state: each one hands a {@link TableScanOutcome} to a queue
 * drained by the calling thread, which performs every merge and every progress call.
 * A watchdog abandons tables that exceed the per-table timeout, and no new table is
 * dispatched once the strategy's wall-clock budget is spent.
 */
@Slf4j
@Service
public class ParallelScanEngine {
    private static final AtomicInteger ENGINE_COUNTER = new AtomicInteger();

    private final DatabaseConnectorRegistry connectorRegistry;
    private final DetectorSet detectorSet;
    private final Duration tableTimeout;
    private final ActivityTracker activityTracker;

    /**
     * Constructor.
     *
     * @param connectorRegistry Registry used to open the scan connections
     * @param detectorSet Detectors applied to sampled cells
     * @param tableTimeout Time a single table may take
     * @param activityTracker Receives per-table events
     */
    public ParallelScanEngine(DatabaseConnectorRegistry connectorRegistry, DetectorSet detectorSet,
                              Duration tableTimeout, ActivityTracker activityTracker) {
        this.connectorRegistry = connectorRegistry;
        this.detectorSet = detectorSet;
        this.tableTimeout = tableTimeout;
        this.activityTracker = activityTracker;
    }

    @Autowired
    public ParallelScanEngine(DatabaseConnectorRegistry connectorRegistry, DetectorSet detectorSet,
                              ScannerProperties properties, ObjectProvider<ActivityTracker> activityTracker) {
        this(connectorRegistry, detectorSet, properties.getTableTimeout(),
                activityTracker.getIfAvailable(NoOpActivityTracker::new));
        log.info("Initialized parallel scan engine with table timeout {}", tableTimeout);
    }

    /**
     * Scans the given tables.
     *
     * @param tables Tables to scan, in dispatch order
     * @param params Connection parameters; the engine opens and closes its own connections
     * @param strategy Strategy giving workers, sample size and budget
     * @param progress Progress sink
     * @return Findings and statistics
     * @throws com.cgi.piiscan.dbscanner.exception.ConnectionException If the scan connections cannot be opened
     */
    public ParallelScanReport scan(List<TableDescriptor> tables, ConnectionParameters params,
                                   ScanStrategy strategy, ProgressSink progress) {
        StopWatch watch = new StopWatch();
        watch.start();

        if (tables.isEmpty()) {
            watch.stop();
            return new ParallelScanReport(List.of(), ScanStats.builder()
                    .elapsed(Duration.ofMillis(watch.getTotalTimeMillis()))
                    .build());
        }

        int workers = Math.max(1, strategy.getWorkers());
        try (DatabaseScanner scanner = connectorRegistry.open(params, workers)) {
            return runTasks(scanner, tables, strategy, workers, progress, watch);
        }
    }

    private ParallelScanReport runTasks(DatabaseScanner scanner, List<TableDescriptor> tables, ScanStrategy strategy,
                                        int workers, ProgressSink progress, StopWatch watch) {
        int engineId = ENGINE_COUNTER.incrementAndGet();
        // In-flight tasks are bounded by the dispatch loop; abandoned workers must not delay new ones
        ExecutorService executor = Executors.newCachedThreadPool(namedDaemon("scan-worker-" + engineId + "-"));
        ScheduledExecutorService watchdog =
                Executors.newSingleThreadScheduledExecutor(namedDaemon("scan-watchdog-" + engineId + "-"));
        BlockingQueue<TableScanOutcome> outcomes = new LinkedBlockingQueue<>();

        long deadline = System.nanoTime() + strategy.getMaxScanTime().toNanos();
        int total = tables.size();
        Iterator<TableDescriptor> pending = tables.iterator();
        Set<String> inFlight = new LinkedHashSet<>();
        int completed = 0;
        boolean budgetExhausted = false;
        boolean interrupted = false;

        List<Finding> findings = new ArrayList<>();
        ScanStats.ScanStatsBuilder stats = ScanStats.builder();
        int scanned = 0;
        int skipped = 0;
        long rowsAnalyzed = 0;

        try {
            while (true) {
                while (inFlight.size() < workers && pending.hasNext()) {
                    if (System.nanoTime() >= deadline) {
                        budgetExhausted = true;
                        break;
                    }
                    TableDescriptor table = pending.next();
                    dispatch(new TableScanTask(scanner, table, strategy.getSampleSize(), detectorSet),
                            executor, watchdog, outcomes);
                    inFlight.add(table.getName());
                }
                if (inFlight.isEmpty()) {
                    break;
                }

                TableScanOutcome outcome = outcomes.take();
                inFlight.remove(outcome.getTableName());
                completed++;

                if (outcome.isScanned()) {
                    scanned++;
                    rowsAnalyzed += outcome.getRowsSampled();
                    findings.addAll(outcome.getFindings());
                    activityTracker.tableScanned(outcome.getTableName(), outcome.getDurationMillis(),
                            outcome.getFindings().size());
                    notifyProgress(progress, completed, total, String.format("Scanned %s: %d findings in %d rows",
                            outcome.getTableName(), outcome.getFindings().size(), outcome.getRowsSampled()));
                } else {
                    skipped++;
                    stats.skippedTable(new SkippedTable(outcome.getTableName(), outcome.getSkipReason(), outcome.getDetail()));
                    activityTracker.tableSkipped(outcome.getTableName(), outcome.getSkipReason());
                    log.warn("Skipped table {} ({}): {}", outcome.getTableName(), outcome.getSkipReason(), outcome.getDetail());
                    notifyProgress(progress, completed, total, String.format("Skipped %s: %s",
                            outcome.getTableName(), outcome.getSkipReason().name().toLowerCase()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            log.warn("Scan interrupted with {} tables in flight", inFlight.size());
            for (String tableName : inFlight) {
                skipped++;
                stats.skippedTable(new SkippedTable(tableName, SkippedTable.Reason.INTERRUPTED,
                        "Scan interrupted while the table was being sampled"));
                activityTracker.tableSkipped(tableName, SkippedTable.Reason.INTERRUPTED);
            }
        } finally {
            shutdown(executor);
            shutdown(watchdog);
        }

        // Tables never dispatched
        SkippedTable.Reason notDispatched = interrupted
                ? SkippedTable.Reason.INTERRUPTED : SkippedTable.Reason.BUDGET_EXHAUSTED;
        String notDispatchedDetail = interrupted
                ? "Scan interrupted before the table was dispatched"
                : "Scan time budget of " + strategy.getMaxScanTime().toSeconds() + "s exhausted";
        while (pending.hasNext()) {
            TableDescriptor table = pending.next();
            skipped++;
            stats.skippedTable(new SkippedTable(table.getName(), notDispatched, notDispatchedDetail));
            activityTracker.tableSkipped(table.getName(), notDispatched);
        }
        if (budgetExhausted) {
            log.warn("Scan time budget exhausted: {} of {} tables scanned", scanned, total);
        }

        watch.stop();
        return new ParallelScanReport(findings, stats
                .tablesScanned(scanned)
                .tablesSkipped(skipped)
                .rowsAnalyzed(rowsAnalyzed)
                .budgetExhausted(budgetExhausted)
                .elapsed(Duration.ofMillis(watch.getTotalTimeMillis()))
                .build());
    }

    /**
     * Submits a task and arms its watchdog. Exactly one outcome reaches the queue per task.
     */
    private void dispatch(TableScanTask task, ExecutorService executor, ScheduledExecutorService watchdog,
                          BlockingQueue<TableScanOutcome> outcomes) {
        String tableName = task.getTable().getName();
        AtomicBoolean delivered = new AtomicBoolean(false);
        long started = System.nanoTime();
        log.debug("Dispatching {}", task);

        Future<?> future = executor.submit(() -> {
            TableScanOutcome outcome;
            try {
                outcome = task.call();
            } catch (InterruptedException e) {
                // Only the watchdog interrupts workers, and it has already reported the timeout
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                outcome = TableScanOutcome.skipped(tableName, SkippedTable.Reason.ERROR,
                        elapsedMillis(started), e.getMessage());
            }
            if (delivered.compareAndSet(false, true)) {
                outcomes.add(outcome);
            }
        });

        watchdog.schedule(() -> {
            if (delivered.compareAndSet(false, true)) {
                future.cancel(true);
                outcomes.add(TableScanOutcome.skipped(tableName, SkippedTable.Reason.TIMEOUT,
                        elapsedMillis(started), "Exceeded table timeout of " + tableTimeout.toMillis() + " ms"));
            }
        }, tableTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static void notifyProgress(ProgressSink progress, int completed, int total, String message) {
        try {
            progress.onProgress(completed, total, message);
        } catch (RuntimeException e) {
            log.warn("Progress callback failed: {}", e.getMessage());
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scan threads did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
