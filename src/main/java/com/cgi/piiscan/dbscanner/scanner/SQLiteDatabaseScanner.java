package com.cgi.piiscan.dbscanner.scanner;

import com.cgi.piiscan.dbscanner.core.scanner.AbstractJdbcDatabaseScanner;
import com.cgi.piiscan.dbscanner.model.ColumnDescriptor;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.zaxxer.hikari.HikariDataSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scanner implementation for SQLite database files.
 * SQLite keeps no row statistics, so each table is counted when it is described.
 */
public class SQLiteDatabaseScanner extends AbstractJdbcDatabaseScanner {
    private static final String SQL_SCAN_TABLES =
            "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";

    public SQLiteDatabaseScanner(HikariDataSource dataSource, int queryTimeoutSeconds) {
        super(dataSource, EngineKind.SQLITE, queryTimeoutSeconds);
    }

    @Override
    protected Map<String, Long> listTables() {
        Map<String, Long> tables = new LinkedHashMap<>();
        jdbcTemplate.query(SQL_SCAN_TABLES, rs -> {
            tables.put(rs.getString("name"), 0L);
        });
        return tables;
    }

    @Override
    protected long countRows(String tableName, long listedEstimate) {
        Long count = executeQuery("countRows", jdbc ->
                jdbc.queryForObject("SELECT COUNT(*) FROM " + escapeIdentifier(tableName), Long.class));
        return count != null ? count : 0L;
    }

    @Override
    protected List<ColumnDescriptor> scanColumns(String tableName) {
        validateTableName(tableName);
        // PRAGMA arguments cannot be bound as parameters
        return jdbcTemplate.query("PRAGMA table_info(" + escapeIdentifier(tableName) + ")",
                (rs, rowNum) -> ColumnDescriptor.of(rs.getString("name"), rs.getString("type")));
    }

    @Override
    protected String buildSampleQuery(String escapedTable) {
        return String.format("SELECT * FROM %s LIMIT ?", escapedTable);
    }

    @Override
    protected String escapeIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
