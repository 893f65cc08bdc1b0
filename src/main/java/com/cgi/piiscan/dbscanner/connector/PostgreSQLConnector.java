package com.cgi.piiscan.dbscanner.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.core.connector.AbstractJdbcConnector;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseType;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.TlsSettings;
import com.cgi.piiscan.dbscanner.scanner.PostgreSQLDatabaseScanner;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Connector for PostgreSQL.
 */
@Component
@DatabaseType(EngineKind.POSTGRESQL)
public class PostgreSQLConnector extends AbstractJdbcConnector {

    public PostgreSQLConnector(ScannerProperties properties) {
        super(properties, EngineKind.POSTGRESQL);
    }

    @Override
    protected String buildJdbcUrl(ConnectionParameters params) {
        return String.format("jdbc:postgresql://%s:%d/%s",
                params.getHost(), params.getEffectivePort(), params.getDatabase());
    }

    @Override
    protected String getDriverClassName() {
        return "org.postgresql.Driver";
    }

    @Override
    protected void applyTls(TlsSettings tls, Properties target) {
        target.setProperty("ssl", "true");
        target.setProperty("sslmode", tls.getMode() != null ? tls.getMode() : "require");
        if (tls.getTrustStorePath() != null) {
            target.setProperty("sslrootcert", tls.getTrustStorePath());
        }
    }

    @Override
    protected DatabaseScanner createScanner(HikariDataSource dataSource, int queryTimeoutSeconds) {
        return new PostgreSQLDatabaseScanner(dataSource, queryTimeoutSeconds);
    }
}
