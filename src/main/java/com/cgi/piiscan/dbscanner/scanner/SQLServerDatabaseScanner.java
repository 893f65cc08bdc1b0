package com.cgi.piiscan.dbscanner.scanner;

import com.cgi.piiscan.dbscanner.core.scanner.AbstractJdbcDatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ColumnDescriptor;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.zaxxer.hikari.HikariDataSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scanner implementation for Microsoft SQL Server databases.
 * Row counts are read from sys.partitions (heap or clustered index only).
 */
public class SQLServerDatabaseScanner extends AbstractJdbcDatabaseScanner {
    private static final String SQL_SCAN_TABLES = """
        SELECT
            t.TABLE_NAME,
            COALESCE(SUM(p.rows), 0) AS ROW_ESTIMATE
        FROM INFORMATION_SCHEMA.TABLES t
        LEFT JOIN sys.partitions p
            ON p.object_id = OBJECT_ID(QUOTENAME(t.TABLE_SCHEMA) + '.' + QUOTENAME(t.TABLE_NAME))
            AND p.index_id IN (0, 1)
        WHERE t.TABLE_TYPE = 'BASE TABLE'
        AND t.TABLE_SCHEMA = SCHEMA_NAME()
        GROUP BY t.TABLE_NAME
        ORDER BY t.TABLE_NAME
    """;

    private static final String SQL_SCAN_COLUMNS = """
        SELECT COLUMN_NAME, DATA_TYPE
        FROM INFORMATION_SCHEMA.COLUMNS
        WHERE TABLE_SCHEMA = SCHEMA_NAME()
        AND TABLE_NAME = ?
        ORDER BY ORDINAL_POSITION
    """;

    public SQLServerDatabaseScanner(HikariDataSource dataSource, int queryTimeoutSeconds) {
        super(dataSource, EngineKind.SQLSERVER, queryTimeoutSeconds);
    }

    @Override
    protected Map<String, Long> listTables() {
        Map<String, Long> tables = new LinkedHashMap<>();
        jdbcTemplate.query(SQL_SCAN_TABLES, rs -> {
            tables.put(rs.getString("TABLE_NAME"), rs.getLong("ROW_ESTIMATE"));
        });
        return tables;
    }

    @Override
    protected List<ColumnDescriptor> scanColumns(String tableName) {
        validateTableName(tableName);
        return jdbcTemplate.query(SQL_SCAN_COLUMNS,
                (rs, rowNum) -> ColumnDescriptor.of(rs.getString("COLUMN_NAME"), rs.getString("DATA_TYPE")),
                tableName);
    }

    @Override
    protected String buildSampleQuery(String escapedTable) {
        return String.format("SELECT TOP (?) * FROM %s", escapedTable);
    }

    /**
     * Escapes an SQL identifier to prevent SQL injection.
     * SQL Server uses square brackets.
     *
     * @param identifier Identifier to escape
     * @return Escaped identifier
     */
    @Override
    protected String escapeIdentifier(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }
}
