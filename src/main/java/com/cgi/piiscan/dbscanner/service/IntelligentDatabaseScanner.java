package com.cgi.piiscan.dbscanner.service;

import com.cgi.piiscan.dbscanner.core.connector.DatabaseConnectorRegistry;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.exception.IntrospectionException;
import com.cgi.piiscan.dbscanner.intelligent.ScanStrategySelector;
import com.cgi.piiscan.dbscanner.intelligent.SchemaRiskAnalyzer;
import com.cgi.piiscan.dbscanner.intelligent.TablePriorityScorer;
import com.cgi.piiscan.dbscanner.intelligent.TableSelector;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.IntrospectionResult;
import com.cgi.piiscan.dbscanner.model.ScanMode;
import com.cgi.piiscan.dbscanner.model.ScanResult;
import com.cgi.piiscan.dbscanner.model.ScanStrategy;
import com.cgi.piiscan.dbscanner.model.SchemaAnalysis;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import com.cgi.piiscan.dbscanner.service.ScanResultAggregator.ScanHeader;
import com.cgi.piiscan.dbscanner.service.cache.NoOpSchemaCache;
import com.cgi.piiscan.dbscanner.service.cache.SchemaCache;
import com.cgi.piiscan.dbscanner.service.tracking.ActivityTracker;
import com.cgi.piiscan.dbscanner.service.tracking.NoOpActivityTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point of a scan: connects, introspects, ranks tables, picks a strategy and runs
 * the parallel scan.
 * <p>
 * Only a connection failure aborts a scan. A schema that cannot be listed or holds no
 * tables produces an empty result carrying a warning.
 */
@Slf4j
@Service
public class IntelligentDatabaseScanner {
    private final DatabaseConnectorRegistry connectorRegistry;
    private final TablePriorityScorer priorityScorer;
    private final SchemaRiskAnalyzer riskAnalyzer;
    private final ScanStrategySelector strategySelector;
    private final TableSelector tableSelector;
    private final ParallelScanEngine scanEngine;
    private final ScanResultAggregator aggregator;
    private final SchemaCache schemaCache;
    private final ActivityTracker activityTracker;

    public IntelligentDatabaseScanner(DatabaseConnectorRegistry connectorRegistry,
                                      TablePriorityScorer priorityScorer,
                                      SchemaRiskAnalyzer riskAnalyzer,
                                      ScanStrategySelector strategySelector,
                                      TableSelector tableSelector,
                                      ParallelScanEngine scanEngine,
                                      ScanResultAggregator aggregator,
                                      SchemaCache schemaCache,
                                      ActivityTracker activityTracker) {
        this.connectorRegistry = connectorRegistry;
        this.priorityScorer = priorityScorer;
        this.riskAnalyzer = riskAnalyzer;
        this.strategySelector = strategySelector;
        this.tableSelector = tableSelector;
        this.scanEngine = scanEngine;
        this.aggregator = aggregator;
        this.schemaCache = schemaCache;
        this.activityTracker = activityTracker;
    }

    @Autowired
    public IntelligentDatabaseScanner(DatabaseConnectorRegistry connectorRegistry,
                                      TablePriorityScorer priorityScorer,
                                      SchemaRiskAnalyzer riskAnalyzer,
                                      ScanStrategySelector strategySelector,
                                      TableSelector tableSelector,
                                      ParallelScanEngine scanEngine,
                                      ScanResultAggregator aggregator,
                                      ObjectProvider<SchemaCache> schemaCache,
                                      ObjectProvider<ActivityTracker> activityTracker) {
        this(connectorRegistry, priorityScorer, riskAnalyzer, strategySelector, tableSelector, scanEngine, aggregator,
                schemaCache.getIfAvailable(NoOpSchemaCache::new),
                activityTracker.getIfAvailable(NoOpActivityTracker::new));
    }

    /**
     * Runs a scan.
     *
     * @param request Scan request
     * @return Scan result
     */
    public ScanResult runScan(ScanRequest request) {
        return runScan(request.getConnection(), request.getScanMode(), request.getMaxTables(), request.getProgress());
    }

    /**
     * Runs a scan.
     *
     * @param params Connection parameters
     * @param mode Scan mode, SMART when null
     * @param maxTables Optional cap on the number of tables scanned
     * @param progress Progress sink, may be null
     * @return Scan result
     * @throws com.cgi.piiscan.dbscanner.exception.ConnectionException If the database cannot be reached
     * @throws IllegalArgumentException If maxTables is not positive
     */
    public ScanResult runScan(ConnectionParameters params, ScanMode mode, Integer maxTables, ProgressSink progress) {
        Objects.requireNonNull(params, "Connection parameters are required");
        if (maxTables != null && maxTables <= 0) {
            throw new IllegalArgumentException("maxTables must be positive: " + maxTables);
        }
        ScanMode scanMode = mode != null ? mode : ScanMode.SMART;
        ProgressSink sink = progress != null ? progress : ProgressSink.none();

        ScanHeader header = new ScanHeader(UUID.randomUUID().toString(), params.getEngine(), scanMode, Instant.now());
        long startedNanos = System.nanoTime();

        log.info("Starting {} scan {} of {}", scanMode, header.getScanId(), params.describe());
        activityTracker.scanStarted(header.getScanId(), params.getEngine());

        try {
            IntrospectionResult introspection;
            try {
                introspection = introspect(params);
            } catch (IntrospectionException e) {
                log.warn("Schema of {} could not be listed: {}", params.describe(), e.getMessage());
                return complete(aggregator.empty(header, IntrospectionResult.empty(), elapsed(startedNanos),
                        "Schema could not be listed: " + e.getMessage()));
            }

            if (introspection.getTables().isEmpty()) {
                log.warn("No tables discovered in {}", params.describe());
                return complete(aggregator.empty(header, introspection, elapsed(startedNanos), "No tables discovered"));
            }

            List<TableDescriptor> scored = introspection.getTables().stream()
                    .map(priorityScorer::score)
                    .toList();
            SchemaAnalysis analysis = riskAnalyzer.analyze(scored);
            ScanStrategy strategy = strategySelector.select(analysis, scanMode, maxTables);
            List<TableDescriptor> selected = tableSelector.select(scored, strategy);

            log.info("Scan {}: {} ({} high / {} medium / {} low priority, risk {}); scanning {} tables with {} workers",
                    header.getScanId(), strategy.getReasoning(), analysis.getHighPriorityTables(),
                    analysis.getMediumPriorityTables(), analysis.getLowPriorityTables(), analysis.getRiskLevel(),
                    selected.size(), strategy.getWorkers());
            notifyProgress(sink, 0, selected.size(), String.format(
                    "Schema analyzed: %d tables, risk %s, scanning %d with %s strategy",
                    analysis.getTotalTables(), analysis.getRiskLevel(), selected.size(), strategy.getKind()));

            ParallelScanReport report = scanEngine.scan(selected, params, strategy, sink);
            ScanResult result = aggregator.aggregate(header, introspection, analysis, strategy, report, elapsed(startedNanos));

            log.info("Completed scan {}: {}/{} tables scanned ({}% coverage), {} skipped, {} findings in {}s",
                    header.getScanId(), result.getTablesScanned(), result.getTablesDiscovered(),
                    String.format("%.1f", result.getCoveragePercent()), result.getTablesSkipped(),
                    result.getFindings().size(), String.format("%.2f", result.getElapsedSeconds()));
            return complete(result);
        } catch (RuntimeException e) {
            log.error("Scan {} of {} failed: {}", header.getScanId(), params.describe(), e.getMessage());
            activityTracker.scanFailed(header.getScanId(), params.getEngine(), e);
            throw e;
        }
    }

    /**
     * Introspects the schema over a single connection, or returns the cached schema.
     */
    private IntrospectionResult introspect(ConnectionParameters params) {
        String cacheKey = SchemaCache.keyFor(params);
        Optional<IntrospectionResult> cached = schemaCache.get(cacheKey);
        if (cached.isPresent()) {
            log.info("Using cached schema for {}", params.describe());
            return cached.get();
        }

        IntrospectionResult result;
        try (DatabaseScanner scanner = connectorRegistry.open(params, 1)) {
            result = scanner.scanTables();
        }
        log.info("Introspected {}: {} tables, {} failures", params.describe(),
                result.getTables().size(), result.getFailures().size());
        schemaCache.put(cacheKey, result);
        return result;
    }

    private ScanResult complete(ScanResult result) {
        activityTracker.scanCompleted(result);
        return result;
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static void notifyProgress(ProgressSink progress, int completed, int total, String message) {
        try {
            progress.onProgress(completed, total, message);
        } catch (RuntimeException e) {
            log.warn("Progress callback failed: {}", e.getMessage());
        }
    }
}
