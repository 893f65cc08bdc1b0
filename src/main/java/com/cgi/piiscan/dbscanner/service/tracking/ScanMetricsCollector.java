package com.cgi.piiscan.dbscanner.service.tracking;

import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.ScanResult;
import com.cgi.piiscan.dbscanner.model.SkippedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Instrumentation service collecting scan metrics across all scans of the application.
 */
@Component
public class ScanMetricsCollector implements ActivityTracker {
    private static final Logger log = LoggerFactory.getLogger(ScanMetricsCollector.class);

    // Scan lifecycle counters
    private final AtomicInteger scansStarted = new AtomicInteger(0);
    private final AtomicInteger scansCompleted = new AtomicInteger(0);
    private final AtomicInteger scansFailed = new AtomicInteger(0);

    // Table counters
    private final AtomicInteger tablesScanned = new AtomicInteger(0);
    private final AtomicLong totalTableTimeMs = new AtomicLong(0);

    // Skips by reason
    private final Map<SkippedTable.Reason, AtomicInteger> skipsByReason = new ConcurrentHashMap<>();

    // Scans by engine
    private final Map<EngineKind, AtomicInteger> scansByEngine = new ConcurrentHashMap<>();

    private final AtomicLong findingsReported = new AtomicLong(0);

    @Override
    public void scanStarted(String scanId, EngineKind engine) {
        scansStarted.incrementAndGet();
        scansByEngine.computeIfAbsent(engine, k -> new AtomicInteger(0)).incrementAndGet();
    }

    @Override
    public void tableScanned(String tableName, long durationMillis, int findingCount) {
        tablesScanned.incrementAndGet();
        totalTableTimeMs.addAndGet(durationMillis);
    }

    @Override
    public void tableSkipped(String tableName, SkippedTable.Reason reason) {
        skipsByReason.computeIfAbsent(reason, k -> new AtomicInteger(0)).incrementAndGet();
    }

    @Override
    public void scanCompleted(ScanResult result) {
        scansCompleted.incrementAndGet();
        findingsReported.addAndGet(result.getFindings().size());
        log.debug("Scan {} recorded: {} findings", result.getScanId(), result.getFindings().size());
    }

    @Override
    public void scanFailed(String scanId, EngineKind engine, Throwable error) {
        scansFailed.incrementAndGet();
    }

    /**
     * Resets all metrics.
     */
    public void resetMetrics() {
        scansStarted.set(0);
        scansCompleted.set(0);
        scansFailed.set(0);
        tablesScanned.set(0);
        totalTableTimeMs.set(0);
        findingsReported.set(0);
        skipsByReason.clear();
        scansByEngine.clear();
    }

    /**
     * Generates a report of collected metrics.
     *
     * @return Map containing all metrics
     */
    public Map<String, Object> getMetricsReport() {
        Map<String, Object> report = new HashMap<>();
        report.put("scansStarted", scansStarted.get());
        report.put("scansCompleted", scansCompleted.get());
        report.put("scansFailed", scansFailed.get());
        report.put("tablesScanned", tablesScanned.get());
        report.put("findingsReported", findingsReported.get());

        int scanned = tablesScanned.get();
        report.put("averageTableTimeMs", scanned > 0 ? (double) totalTableTimeMs.get() / scanned : 0.0);

        Map<String, Integer> skips = new HashMap<>();
        skipsByReason.forEach((reason, count) -> skips.put(reason.name(), count.get()));
        report.put("tablesSkipped", skips);

        Map<String, Integer> engines = new HashMap<>();
        scansByEngine.forEach((engine, count) -> engines.put(engine.getId(), count.get()));
        report.put("scansByEngine", engines);
        return report;
    }
}
