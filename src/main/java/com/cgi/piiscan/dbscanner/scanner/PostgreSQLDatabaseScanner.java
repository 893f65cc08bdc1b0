package com.cgi.piiscan.dbscanner.scanner;

import com.cgi.piiscan.dbscanner.core.scanner.AbstractJdbcDatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ColumnDescriptor;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.zaxxer.hikari.HikariDataSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scanner implementation for PostgreSQL databases.
 * Row counts come from the planner statistics in pg_class, so no table is fully counted.
 */
public class PostgreSQLDatabaseScanner extends AbstractJdbcDatabaseScanner {
    private static final String SQL_SCAN_TABLES = """
        SELECT
            t.table_name,
            GREATEST(COALESCE(c.reltuples, 0), 0)::bigint AS row_estimate
        FROM information_schema.tables t
        LEFT JOIN pg_catalog.pg_namespace n
            ON n.nspname = t.table_schema
        LEFT JOIN pg_catalog.pg_class c
            ON c.relname = t.table_name
            AND c.relnamespace = n.oid
        WHERE t.table_schema = current_schema()
        AND t.table_type = 'BASE TABLE'
        ORDER BY t.table_name
    """;

    private static final String SQL_SCAN_COLUMNS = """
        SELECT column_name, data_type
        FROM information_schema.columns
        WHERE table_schema = current_schema()
        AND table_name = ?
        ORDER BY ordinal_position
    """;

    public PostgreSQLDatabaseScanner(HikariDataSource dataSource, int queryTimeoutSeconds) {
        super(dataSource, EngineKind.POSTGRESQL, queryTimeoutSeconds);
    }

    @Override
    protected Map<String, Long> listTables() {
        Map<String, Long> tables = new LinkedHashMap<>();
        jdbcTemplate.query(SQL_SCAN_TABLES, rs -> {
            tables.put(rs.getString("table_name"), rs.getLong("row_estimate"));
        });
        return tables;
    }

    @Override
    protected List<ColumnDescriptor> scanColumns(String tableName) {
        validateTableName(tableName);
        return jdbcTemplate.query(SQL_SCAN_COLUMNS,
                (rs, rowNum) -> ColumnDescriptor.of(rs.getString("column_name"), rs.getString("data_type")),
                tableName);
    }

    @Override
    protected String buildSampleQuery(String escapedTable) {
        return String.format("SELECT * FROM %s LIMIT ?", escapedTable);
    }

    /**
     * Escapes an SQL identifier to prevent SQL injection.
     * PostgreSQL uses double quotes.
     *
     * @param identifier Identifier to escape
     * @return Escaped identifier
     */
    @Override
    protected String escapeIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
