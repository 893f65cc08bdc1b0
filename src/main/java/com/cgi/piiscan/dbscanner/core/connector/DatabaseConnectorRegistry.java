package com.cgi.piiscan.dbscanner.core.connector;

import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of database connectors.
 * Finds all connectors carrying the @DatabaseType annotation.
 */
@Component
public class DatabaseConnectorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnectorRegistry.class);

    /**
     * Map of engine kinds to connectors.
     */
    private final Map<EngineKind, DatabaseConnector> connectors = new EnumMap<>(EngineKind.class);

    /**
     * Constructor.
     *
     * @param connectors All connector beans
     */
    public DatabaseConnectorRegistry(List<DatabaseConnector> connectors) {
        for (DatabaseConnector connector : connectors) {
            DatabaseType type = AnnotationUtils.findAnnotation(connector.getClass(), DatabaseType.class);
            if (type == null) {
                logger.warn("Ignoring connector without @DatabaseType: {}", connector.getClass().getName());
                continue;
            }
            DatabaseConnector previous = this.connectors.put(type.value(), connector);
            if (previous != null) {
                throw new IllegalStateException("Duplicate connectors for engine " + type.value() + ": "
                        + previous.getClass().getSimpleName() + ", " + connector.getClass().getSimpleName());
            }
        }

        logger.info("Registered database connectors: {}", this.connectors.keySet());
    }

    /**
     * Opens a scanner for the engine named in the parameters.
     *
     * @param params Connection parameters
     * @param maxConnections Pool size
     * @return Open database scanner
     */
    public DatabaseScanner open(ConnectionParameters params, int maxConnections) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        }
        DatabaseConnector connector = connectors.get(params.getEngine());
        if (connector == null) {
            throw new IllegalArgumentException("Unsupported database engine: " + params.getEngine());
        }

        logger.debug("Opening {} with up to {} connections", params.describe(), maxConnections);
        return connector.open(params, maxConnections);
    }

    /**
     * Gets the list of supported engines.
     *
     * @return Supported engines
     */
    public List<EngineKind> getSupportedEngines() {
        return new ArrayList<>(connectors.keySet());
    }
}
