package com.cgi.piiscan.dbscanner.core.scanner;

import com.cgi.piiscan.dbscanner.model.DataSample;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.IntrospectionResult;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;

/**
 * Interface for database scanners.
 * A scanner is bound to an open connection (pool) and must be closed by whoever opened it.
 */
public interface DatabaseScanner extends AutoCloseable {
    /**
     * Gets the engine this scanner talks to.
     *
     * @return Engine kind
     */
    EngineKind getEngineKind();

    /**
     * Scans all available tables, collections or key spaces.
     * Tables that cannot be described are reported as failures rather than aborting the scan.
     *
     * @return Described tables and per-table failures
     * @throws com.cgi.piiscan.dbscanner.exception.IntrospectionException If the catalog itself cannot be listed
     */
    IntrospectionResult scanTables();

    /**
     * Samples data from a table.
     *
     * @param table Table to sample
     * @param limit Maximum number of rows
     * @return Data sample
     * @throws com.cgi.piiscan.dbscanner.exception.SamplingException On error
     */
    DataSample sampleTableData(TableDescriptor table, int limit);

    /**
     * Releases the connections held by this scanner.
     */
    @Override
    void close();

    /**
     * Validates a table name.
     *
     * @param tableName Table name to validate
     * @throws IllegalArgumentException If the name is invalid
     */
    default void validateTableName(String tableName) {
        if (tableName == null || tableName.trim().isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
    }
}
