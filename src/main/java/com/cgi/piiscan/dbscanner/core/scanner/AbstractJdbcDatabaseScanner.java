package com.cgi.piiscan.dbscanner.core.scanner;

import com.cgi.piiscan.dbscanner.exception.IntrospectionException;
import com.cgi.piiscan.dbscanner.exception.SamplingException;
import com.cgi.piiscan.dbscanner.exception.ScannerException;
import com.cgi.piiscan.dbscanner.model.ColumnDescriptor;
import com.cgi.piiscan.dbscanner.model.DataSample;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.IntrospectionFailure;
import com.cgi.piiscan.dbscanner.model.IntrospectionResult;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Abstract base class for relational database scanners.
 * Owns the connection pool opened by the connector and closes it on {@link #close()}.
 */
public abstract class AbstractJdbcDatabaseScanner implements DatabaseScanner {
    /**
     * The JDBC template used to execute SQL queries.
     */
    protected final JdbcTemplate jdbcTemplate;

    /**
     * Logger for this class.
     */
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final HikariDataSource dataSource;

    private final EngineKind engineKind;

    /**
     * Constructor.
     *
     * @param dataSource The pooled data source, owned by this scanner from now on
     * @param engineKind The engine
     * @param queryTimeoutSeconds Statement timeout
     */
    protected AbstractJdbcDatabaseScanner(HikariDataSource dataSource, EngineKind engineKind, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.engineKind = engineKind;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        configureJdbcTemplate(queryTimeoutSeconds);
    }

    private void configureJdbcTemplate(int queryTimeoutSeconds) {
        jdbcTemplate.setFetchSize(500);
        jdbcTemplate.setMaxRows(10000);
        jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
    }

    @Override
    public EngineKind getEngineKind() {
        return engineKind;
    }

    @Override
    public IntrospectionResult scanTables() {
        Map<String, Long> listed;
        try {
            listed = executeQuery("listTables", jdbc -> listTables());
        } catch (ScannerException e) {
            throw new IntrospectionException("Cannot list tables of " + engineKind.getId() + " database", e);
        }
        logger.debug("Found {} tables", listed.size());

        List<TableDescriptor> tables = new ArrayList<>(listed.size());
        List<IntrospectionFailure> failures = new ArrayList<>();
        for (Map.Entry<String, Long> entry : listed.entrySet()) {
            String tableName = entry.getKey();
            try {
                long rows = countRows(tableName, entry.getValue());
                List<ColumnDescriptor> columns = executeQuery("scanColumns", jdbc -> scanColumns(tableName));
                tables.add(TableDescriptor.builder()
                        .name(tableName)
                        .estimatedRowCount(Math.max(rows, 0))
                        .columns(columns)
                        .build());
            } catch (RuntimeException e) {
                String reason = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
                logger.warn("Skipping table {} during introspection: {}", tableName, reason);
                failures.add(new IntrospectionFailure(tableName, reason));
            }
        }
        return new IntrospectionResult(tables, failures);
    }

    @Override
    public DataSample sampleTableData(TableDescriptor table, int limit) {
        validateTableName(table.getName());
        String sql = buildSampleQuery(escapeIdentifier(table.getName()));
        try {
            return executeQuery("sampleTableData", jdbc ->
                    DataSample.fromRows(table.getName(), jdbc.queryForList(sql, limit)));
        } catch (ScannerException e) {
            throw new SamplingException("Error sampling table " + table.getName(), e);
        }
    }

    /**
     * Executes a query with standardized error handling.
     *
     * @param operationName Operation name for logging
     * @param query Function that executes the query
     * @return Query result
     * @throws ScannerException On error
     */
    protected <T> T executeQuery(String operationName, Function<JdbcTemplate, T> query) {
        try {
            logger.debug("Executing operation: {}", operationName);
            T result = query.apply(jdbcTemplate);
            logger.debug("Operation completed successfully: {}", operationName);
            return result;
        } catch (DataAccessException e) {
            logger.debug("Database error executing {}: {}", operationName, e.getMessage());
            throw new ScannerException("Error during " + operationName, e);
        }
    }

    /**
     * Lists base tables with the engine's row-count estimate.
     *
     * @return Table names in discovery order mapped to estimated row counts
     */
    protected abstract Map<String, Long> listTables();

    /**
     * Scans the columns of a table in declaration order.
     *
     * @param tableName Table name
     * @return Columns
     */
    protected abstract List<ColumnDescriptor> scanColumns(String tableName);

    /**
     * Gets the row count of a table. Engines without catalog statistics override this.
     *
     * @param tableName Table name
     * @param listedEstimate Estimate returned by {@link #listTables()}
     * @return Row count
     */
    protected long countRows(String tableName, long listedEstimate) {
        return listedEstimate;
    }

    /**
     * Builds the sampling query. The query takes the row limit as its only parameter.
     *
     * @param escapedTable Escaped table name
     * @return SQL
     */
    protected abstract String buildSampleQuery(String escapedTable);

    /**
     * Escapes an SQL identifier to prevent SQL injection.
     *
     * @param identifier Identifier to escape
     * @return Escaped identifier
     */
    protected abstract String escapeIdentifier(String identifier);

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            logger.debug("Closing connection pool {}", dataSource.getPoolName());
            dataSource.close();
        }
    }
}
