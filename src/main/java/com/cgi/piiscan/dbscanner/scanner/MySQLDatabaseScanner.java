package com.cgi.piiscan.dbscanner.scanner;

import com.cgi.piiscan.dbscanner.core.scanner.AbstractJdbcDatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ColumnDescriptor;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.zaxxer.hikari.HikariDataSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scanner implementation for MySQL databases.
 */
public class MySQLDatabaseScanner extends AbstractJdbcDatabaseScanner {
    // SQL constants for reuse
    private static final String SQL_SCAN_TABLES = """
        SELECT
            t.TABLE_NAME,
            t.TABLE_ROWS as ROW_COUNT
        FROM information_schema.TABLES t
        WHERE t.TABLE_SCHEMA = database()
        AND t.TABLE_TYPE = 'BASE TABLE'
        ORDER BY t.TABLE_NAME
    """;

    private static final String SQL_SCAN_COLUMNS = """
        SELECT
            c.COLUMN_NAME,
            c.DATA_TYPE
        FROM information_schema.COLUMNS c
        WHERE c.TABLE_SCHEMA = database()
        AND c.TABLE_NAME = ?
        ORDER BY c.ORDINAL_POSITION
    """;

    public MySQLDatabaseScanner(HikariDataSource dataSource, int queryTimeoutSeconds) {
        super(dataSource, EngineKind.MYSQL, queryTimeoutSeconds);
    }

    @Override
    protected Map<String, Long> listTables() {
        Map<String, Long> tables = new LinkedHashMap<>();
        jdbcTemplate.query(SQL_SCAN_TABLES, rs -> {
            // TABLE_ROWS is NULL for views and some storage engines
            tables.put(rs.getString("TABLE_NAME"), rs.getLong("ROW_COUNT"));
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
        return String.format("SELECT * FROM %s LIMIT ?", escapedTable);
    }

    /**
     * Escapes an SQL identifier to prevent SQL injection.
     * MySQL uses backticks.
     *
     * @param identifier Identifier to escape
     * @return Escaped identifier
     */
    @Override
    protected String escapeIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
