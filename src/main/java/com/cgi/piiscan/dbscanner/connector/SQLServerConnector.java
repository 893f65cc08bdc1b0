package com.cgi.piiscan.dbscanner.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.core.connector.AbstractJdbcConnector;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseType;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.TlsSettings;
import com.cgi.piiscan.dbscanner.scanner.SQLServerDatabaseScanner;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Connector for Microsoft SQL Server and Azure SQL.
 */
@Component
@DatabaseType(EngineKind.SQLSERVER)
public class SQLServerConnector extends AbstractJdbcConnector {

    public SQLServerConnector(ScannerProperties properties) {
        super(properties, EngineKind.SQLSERVER);
    }

    @Override
    protected String buildJdbcUrl(ConnectionParameters params) {
        // Recent drivers encrypt by default, so plain connections must opt out explicitly
        return String.format("jdbc:sqlserver://%s:%d;databaseName=%s;encrypt=%s",
                params.getHost(), params.getEffectivePort(), params.getDatabase(), params.isTlsEnabled());
    }

    @Override
    protected String getDriverClassName() {
        return "com.microsoft.sqlserver.jdbc.SQLServerDriver";
    }

    @Override
    protected void applyTls(TlsSettings tls, Properties target) {
        boolean verify = tls.getMode() == null || tls.getMode().startsWith("verify");
        target.setProperty("trustServerCertificate", String.valueOf(!verify));
        if (tls.getTrustStorePath() != null) {
            target.setProperty("trustStore", tls.getTrustStorePath());
            if (tls.getTrustStorePassword() != null) {
                target.setProperty("trustStorePassword", tls.getTrustStorePassword());
            }
        }
    }

    @Override
    protected DatabaseScanner createScanner(HikariDataSource dataSource, int queryTimeoutSeconds) {
        return new SQLServerDatabaseScanner(dataSource, queryTimeoutSeconds);
    }
}
