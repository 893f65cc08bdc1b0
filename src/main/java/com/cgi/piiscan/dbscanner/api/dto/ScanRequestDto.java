package com.cgi.piiscan.dbscanner.api.dto;

import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.ScanMode;
import com.cgi.piiscan.dbscanner.model.TlsSettings;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;

import java.util.Map;

/**
 * DTO for scan requests from the API.
 */
@Data
@ToString(exclude = {"password", "tlsTrustStorePassword"})
public class ScanRequestDto {
    @NotNull
    private EngineKind engine;

    private String host;

    /**
     * Port, engine default when absent.
     */
    @Positive
    private Integer port;

    /**
     * Database name, SQLite file path or Redis database index.
     */
    private String database;

    private String username;

    private String password;

    private boolean tls;

    private String tlsMode;

    private String tlsTrustStorePath;

    private String tlsTrustStorePassword;

    /**
     * Additional driver properties.
     */
    private Map<String, String> properties;

    private ScanMode scanMode = ScanMode.SMART;

    @Positive
    private Integer maxTables;

    /**
     * Converts this request to connection parameters.
     *
     * @return Connection parameters
     */
    public ConnectionParameters toConnectionParameters() {
        ConnectionParameters.ConnectionParametersBuilder builder = ConnectionParameters.builder()
                .engine(engine)
                .host(host)
                .port(port)
                .database(database)
                .username(username)
                .password(password)
                .tls(TlsSettings.builder()
                        .enabled(tls)
                        .mode(tlsMode)
                        .trustStorePath(tlsTrustStorePath)
                        .trustStorePassword(tlsTrustStorePassword)
                        .build());
        if (properties != null) {
            builder.properties(properties);
        }
        return builder.build();
    }
}
