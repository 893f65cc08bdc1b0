package com.cgi.piiscan.dbscanner.api;

import com.cgi.piiscan.dbscanner.api.dto.ApiResponse;
import com.cgi.piiscan.dbscanner.api.dto.ScanRequestDto;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseConnectorRegistry;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.ScanResult;
import com.cgi.piiscan.dbscanner.service.IntelligentDatabaseScanner;
import com.cgi.piiscan.dbscanner.service.ScanRequest;
import com.cgi.piiscan.dbscanner.service.tracking.ScanMetricsCollector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Controller for database scans.
 */
@RestController
@RequestMapping("/api/scans")
@Tag(name = "Database Scans", description = "API for scanning databases for personal data")
public class ScanController {
    private static final Logger logger = LoggerFactory.getLogger(ScanController.class);

    private final IntelligentDatabaseScanner scanner;
    private final DatabaseConnectorRegistry connectorRegistry;
    private final ScanMetricsCollector metricsCollector;

    public ScanController(IntelligentDatabaseScanner scanner, DatabaseConnectorRegistry connectorRegistry,
                          ScanMetricsCollector metricsCollector) {
        this.scanner = scanner;
        this.connectorRegistry = connectorRegistry;
        this.metricsCollector = metricsCollector;
    }

    @Operation(summary = "Scan a database for personal data")
    @PostMapping
    public ResponseEntity<ApiResponse<ScanResult>> scan(@Valid @RequestBody ScanRequestDto request) {
        logger.info("Scan requested for {} in {} mode", request.getEngine(), request.getScanMode());

        ScanRequest scanRequest = ScanRequest.builder()
                .connection(request.toConnectionParameters())
                .scanMode(request.getScanMode())
                .maxTables(request.getMaxTables())
                .progress((completed, total, message) ->
                        logger.info("Progress {}/{}: {}", completed, total, message))
                .build();

        return ResponseEntity.ok(ApiResponse.success(scanner.runScan(scanRequest)));
    }

    @Operation(summary = "List supported database engines")
    @GetMapping("/engines")
    public ResponseEntity<ApiResponse<List<EngineKind>>> engines() {
        return ResponseEntity.ok(ApiResponse.success(connectorRegistry.getSupportedEngines()));
    }

    @Operation(summary = "Get scan metrics collected since startup")
    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<Map<String, Object>>> metrics() {
        return ResponseEntity.ok(ApiResponse.success(metricsCollector.getMetricsReport()));
    }
}
