package com.cgi.piiscan.dbscanner.api;

import com.cgi.piiscan.dbscanner.api.handler.GlobalExceptionHandler;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseConnectorRegistry;
import com.cgi.piiscan.dbscanner.exception.ConnectionException;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.ScanMode;
import com.cgi.piiscan.dbscanner.model.ScanResult;
import com.cgi.piiscan.dbscanner.service.IntelligentDatabaseScanner;
import com.cgi.piiscan.dbscanner.service.ScanRequest;
import com.cgi.piiscan.dbscanner.service.tracking.ScanMetricsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ScanControllerTest {

    private IntelligentDatabaseScanner scanner;
    private DatabaseConnectorRegistry registry;
    private ScanMetricsCollector metrics;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        scanner = mock(IntelligentDatabaseScanner.class);
        registry = mock(DatabaseConnectorRegistry.class);
        metrics = new ScanMetricsCollector();
        mockMvc = MockMvcBuilders.standaloneSetup(new ScanController(scanner, registry, metrics))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void runsScanAndWrapsResult() throws Exception {
        // Given
        when(scanner.runScan(any(ScanRequest.class))).thenReturn(ScanResult.builder()
                .scanId("scan-42")
                .engine(EngineKind.POSTGRESQL)
                .scanMode(ScanMode.DEEP)
                .tablesDiscovered(12)
                .tablesScanned(12)
                .coveragePercent(100.0)
                .build());

        // When / Then
        mockMvc.perform(post("/api/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"engine": "POSTGRESQL", "host": "db", "database": "crm",
                                 "username": "scanner", "password": "pw", "scanMode": "DEEP", "maxTables": 20}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.scanId").value("scan-42"))
                .andExpect(jsonPath("$.data.tablesScanned").value(12));

        ArgumentCaptor<ScanRequest> captor = ArgumentCaptor.forClass(ScanRequest.class);
        verify(scanner).runScan(captor.capture());
        ScanRequest request = captor.getValue();
        assertThat(request.getScanMode()).isEqualTo(ScanMode.DEEP);
        assertThat(request.getMaxTables()).isEqualTo(20);
        assertThat(request.getConnection().describe()).isEqualTo("postgresql://db:5432/crm");
        assertThat(request.getConnection().getPassword()).isEqualTo("pw");
    }

    @Test
    void missingEngineIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host\": \"db\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("INVALID_ARGUMENT"));

        verifyNoInteractions(scanner);
    }

    @Test
    void nonPositiveMaxTablesIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"engine\": \"MYSQL\", \"host\": \"db\", \"maxTables\": 0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void connectionFailureIsBadGateway() throws Exception {
        when(scanner.runScan(any(ScanRequest.class)))
                .thenThrow(new ConnectionException(EngineKind.MYSQL, "Failed to connect to mysql://db:3306/crm"));

        mockMvc.perform(post("/api/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"engine\": \"MYSQL\", \"host\": \"db\", \"database\": \"crm\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("CONNECTION_ERROR"));
    }

    @Test
    void listsSupportedEngines() throws Exception {
        when(registry.getSupportedEngines()).thenReturn(List.of(EngineKind.POSTGRESQL, EngineKind.REDIS));

        mockMvc.perform(get("/api/scans/engines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0]").value("POSTGRESQL"))
                .andExpect(jsonPath("$.data[1]").value("REDIS"));
    }

    @Test
    void exposesMetricsReport() throws Exception {
        metrics.scanStarted("scan-1", EngineKind.SQLITE);
        metrics.scanFailed("scan-1", EngineKind.SQLITE, new IllegalStateException("down"));

        mockMvc.perform(get("/api/scans/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.scansStarted").value(1))
                .andExpect(jsonPath("$.data.scansFailed").value(1))
                .andExpect(jsonPath("$.data.scansByEngine.sqlite").value(1));
    }
}
