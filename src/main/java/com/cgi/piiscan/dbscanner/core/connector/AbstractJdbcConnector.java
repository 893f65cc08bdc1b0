package com.cgi.piiscan.dbscanner.core.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.exception.ConnectionException;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.TlsSettings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base connector for JDBC engines.
 * Builds a HikariCP pool from the connection parameters and validates it by borrowing one connection.
 */
public abstract class AbstractJdbcConnector implements DatabaseConnector {
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final ScannerProperties properties;

    private final EngineKind engineKind;

    protected AbstractJdbcConnector(ScannerProperties properties, EngineKind engineKind) {
        this.properties = properties;
        this.engineKind = engineKind;
    }

    @Override
    public DatabaseScanner open(ConnectionParameters params, int maxConnections) {
        HikariDataSource dataSource = null;
        try {
            dataSource = new HikariDataSource(buildConfig(params, maxConnections));
            try (Connection connection = dataSource.getConnection()) {
                logger.debug("Validated connection to {} ({})", params.describe(),
                        connection.getMetaData().getDatabaseProductVersion());
            }
            return createScanner(dataSource, queryTimeoutSeconds());
        } catch (ConnectionException e) {
            closeQuietly(dataSource);
            throw e;
        } catch (Exception e) {
            closeQuietly(dataSource);
            logger.error("Failed to connect to {}: {}", params.describe(), e.getMessage());
            throw new ConnectionException(engineKind, "Failed to connect to " + params.describe(), e);
        }
    }

    /**
     * Creates the pool configuration.
     *
     * @param params Connection parameters
     * @param maxConnections Maximum pool size
     * @return Hikari configuration
     */
    protected HikariConfig buildConfig(ConnectionParameters params, int maxConnections) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("piiscan-" + engineKind.getId() + "-" + POOL_COUNTER.incrementAndGet());
        config.setJdbcUrl(buildJdbcUrl(params));
        config.setDriverClassName(getDriverClassName());
        if (params.getUsername() != null) {
            config.setUsername(params.getUsername());
        }
        if (params.getPassword() != null) {
            config.setPassword(params.getPassword());
        }

        // Pool configuration
        config.setMaximumPoolSize(maxConnections);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(properties.getConnectTimeout().toMillis());
        // Fail in the constructor rather than on first borrow
        config.setInitializationFailTimeout(properties.getConnectTimeout().toMillis());
        config.setReadOnly(true);
        config.setAutoCommit(true);

        Properties dataSourceProperties = new Properties();
        if (params.isTlsEnabled()) {
            applyTls(params.getTls(), dataSourceProperties);
        }
        dataSourceProperties.putAll(params.getProperties());
        config.setDataSourceProperties(dataSourceProperties);
        return config;
    }

    /**
     * Statement timeout derived from the table timeout, rounded up to whole seconds.
     * JDBC reads a timeout of 0 as unlimited, so it is never below one second.
     */
    protected int queryTimeoutSeconds() {
        long millis = properties.getTableTimeout().toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    private void closeQuietly(HikariDataSource dataSource) {
        if (dataSource != null) {
            try {
                dataSource.close();
            } catch (RuntimeException e) {
                logger.debug("Error closing pool after failed connect: {}", e.getMessage());
            }
        }
    }

    /**
     * Builds a JDBC URL from connection parameters.
     *
     * @param params Connection parameters
     * @return The JDBC URL
     */
    protected abstract String buildJdbcUrl(ConnectionParameters params);

    /**
     * Gets the JDBC driver class name.
     *
     * @return Driver class name
     */
    protected abstract String getDriverClassName();

    /**
     * Adds the driver properties enabling TLS.
     *
     * @param tls TLS settings, enabled
     * @param target Driver properties
     */
    protected abstract void applyTls(TlsSettings tls, Properties target);

    /**
     * Creates the engine scanner owning the pool.
     *
     * @param dataSource Validated pool
     * @param queryTimeoutSeconds Statement timeout
     * @return Scanner
     */
    protected abstract DatabaseScanner createScanner(HikariDataSource dataSource, int queryTimeoutSeconds);
}
