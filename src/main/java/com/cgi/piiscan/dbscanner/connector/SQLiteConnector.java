package com.cgi.piiscan.dbscanner.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.core.connector.AbstractJdbcConnector;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseType;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.exception.ConnectionException;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.TlsSettings;
import com.cgi.piiscan.dbscanner.scanner.SQLiteDatabaseScanner;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Connector for SQLite database files.
 * The database field holds the file path; a missing file is a connection error, never a new empty database.
 */
@Component
@DatabaseType(EngineKind.SQLITE)
public class SQLiteConnector extends AbstractJdbcConnector {

    public SQLiteConnector(ScannerProperties properties) {
        super(properties, EngineKind.SQLITE);
    }

    @Override
    public DatabaseScanner open(ConnectionParameters params, int maxConnections) {
        if (params.getDatabase() == null || !Files.isRegularFile(Path.of(params.getDatabase()))) {
            throw new ConnectionException(EngineKind.SQLITE, "SQLite database file not found: " + params.getDatabase());
        }
        return super.open(params, maxConnections);
    }

    @Override
    protected HikariConfig buildConfig(ConnectionParameters params, int maxConnections) {
        HikariConfig config = super.buildConfig(params, maxConnections);
        // The driver cannot switch a live connection to read-only, so open the file read-only
        config.addDataSourceProperty("open_mode", "1");
        return config;
    }

    @Override
    protected String buildJdbcUrl(ConnectionParameters params) {
        return "jdbc:sqlite:" + params.getDatabase();
    }

    @Override
    protected String getDriverClassName() {
        return "org.sqlite.JDBC";
    }

    @Override
    protected void applyTls(TlsSettings tls, Properties target) {
        logger.debug("Ignoring TLS settings for a local SQLite file");
    }

    @Override
    protected DatabaseScanner createScanner(HikariDataSource dataSource, int queryTimeoutSeconds) {
        return new SQLiteDatabaseScanner(dataSource, queryTimeoutSeconds);
    }
}
