package com.cgi.piiscan.dbscanner.core.connector;

import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;

/**
 * Opens connections to one database engine.
 * Implementations are annotated with {@link DatabaseType} and registered as Spring beans.
 */
public interface DatabaseConnector {
    /**
     * Opens a connection pool and validates the credentials.
     * The returned scanner owns the pool and must be closed by the caller.
     *
     * @param params Connection parameters
     * @param maxConnections Maximum number of connections the scanner may hold at once
     * @return Scanner bound to the open connection
     * @throws com.cgi.piiscan.dbscanner.exception.ConnectionException If the engine is unreachable or refuses the credentials
     */
    DatabaseScanner open(ConnectionParameters params, int maxConnections);
}
