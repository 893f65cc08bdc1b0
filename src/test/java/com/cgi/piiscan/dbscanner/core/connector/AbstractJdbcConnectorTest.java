package com.cgi.piiscan.dbscanner.core.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.connector.PostgreSQLConnector;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AbstractJdbcConnectorTest {

    private final ScannerProperties properties = new ScannerProperties();

    @Test
    void postgresPoolIsReadOnlyAndSizedForWorkers() {
        // Given
        properties.setConnectTimeout(Duration.ofSeconds(7));
        PostgreSQLConnector connector = new PostgreSQLConnector(properties);

        // When
        HikariConfig config = connector.buildConfig(ConnectionParameters.builder()
                .engine(EngineKind.POSTGRESQL)
                .host("db.internal")
                .database("crm")
                .username("scanner")
                .password("pw")
                .property("ApplicationName", "piiscan")
                .build(), 3);

        // Then
        assertThat(config.getJdbcUrl()).isEqualTo("jdbc:postgresql://db.internal:5432/crm");
        assertThat(config.getMaximumPoolSize()).isEqualTo(3);
        assertThat(config.getMinimumIdle()).isZero();
        assertThat(config.isReadOnly()).isTrue();
        assertThat(config.getConnectionTimeout()).isEqualTo(7000);
        assertThat(config.getPoolName()).startsWith("piiscan-postgresql-");
        assertThat(config.getDataSourceProperties()).containsEntry("ApplicationName", "piiscan");
    }

    @Test
    void subSecondTableTimeoutStillBoundsQueries() {
        properties.setTableTimeout(Duration.ofMillis(300));

        assertThat(new PostgreSQLConnector(properties).queryTimeoutSeconds()).isEqualTo(1);
    }

    @Test
    void queryTimeoutRoundsUpToWholeSeconds() {
        PostgreSQLConnector connector = new PostgreSQLConnector(properties);

        properties.setTableTimeout(Duration.ofMillis(2500));
        assertThat(connector.queryTimeoutSeconds()).isEqualTo(3);

        properties.setTableTimeout(Duration.ofSeconds(60));
        assertThat(connector.queryTimeoutSeconds()).isEqualTo(60);
    }
}
