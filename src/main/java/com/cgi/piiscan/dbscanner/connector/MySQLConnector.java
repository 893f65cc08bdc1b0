package com.cgi.piiscan.dbscanner.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.core.connector.AbstractJdbcConnector;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseType;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.TlsSettings;
import com.cgi.piiscan.dbscanner.scanner.MySQLDatabaseScanner;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Properties;

/**
 * Connector for MySQL and MariaDB.
 */
@Component
@DatabaseType(EngineKind.MYSQL)
public class MySQLConnector extends AbstractJdbcConnector {

    public MySQLConnector(ScannerProperties properties) {
        super(properties, EngineKind.MYSQL);
    }

    @Override
    protected String buildJdbcUrl(ConnectionParameters params) {
        return String.format("jdbc:mysql://%s:%d/%s",
                params.getHost(), params.getEffectivePort(), params.getDatabase());
    }

    @Override
    protected String getDriverClassName() {
        return "com.mysql.cj.jdbc.Driver";
    }

    @Override
    protected void applyTls(TlsSettings tls, Properties target) {
        // Connector/J expects REQUIRED, VERIFY_CA or VERIFY_IDENTITY
        String mode = tls.getMode() != null
                ? tls.getMode().toUpperCase(Locale.ROOT).replace('-', '_')
                : "REQUIRED";
        if ("VERIFY_FULL".equals(mode)) {
            mode = "VERIFY_IDENTITY";
        }
        target.setProperty("sslMode", mode);
        if (tls.getTrustStorePath() != null) {
            target.setProperty("trustCertificateKeyStoreUrl", "file:" + tls.getTrustStorePath());
            if (tls.getTrustStorePassword() != null) {
                target.setProperty("trustCertificateKeyStorePassword", tls.getTrustStorePassword());
            }
        }
    }

    @Override
    protected DatabaseScanner createScanner(HikariDataSource dataSource, int queryTimeoutSeconds) {
        return new MySQLDatabaseScanner(dataSource, queryTimeoutSeconds);
    }
}
