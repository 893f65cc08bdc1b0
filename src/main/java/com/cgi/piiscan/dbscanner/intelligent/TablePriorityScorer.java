/*
 * TablePriorityScorer.java - Name-based sensitivity scoring of tables and columns
 */
package com.cgi.piiscan.dbscanner.intelligent;

import com.cgi.piiscan.dbscanner.model.ColumnDescriptor;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores how likely a table is to hold personal data, from its name and the names of its columns.
 * Pure and thread-safe.
 */
@Component
public class TablePriorityScorer {
    /**
     * Upper bound of any priority score.
     */
    public static final double MAX_SCORE = 3.5;

    private static final double BASE_SCORE = 1.0;
    private static final double COLUMN_BOOST_FACTOR = 0.3;

    private static final Map<String, Double> TABLE_KEYWORDS;
    private static final Map<String, Double> COLUMN_KEYWORDS;

    static {
        Map<String, Double> table = new LinkedHashMap<>();
        // People and health
        weight(table, 3.0, "user", "customer", "employee", "person", "people", "patient", "medical", "health");
        // Financial and credentials
        weight(table, 2.8, "payment", "billing", "financial", "profile", "account", "bank", "credential", "password");
        // Contact and transactional data
        weight(table, 2.5, "transaction", "contact", "address", "phone", "email", "invoice", "card", "token");
        weight(table, 2.2, "order");
        weight(table, 2.0, "session", "audit", "config", "setting");
        weight(table, 1.5, "log");
        weight(table, 1.2, "system");
        weight(table, 1.0, "backup");
        weight(table, 0.8, "temp");
        weight(table, 0.5, "test");
        TABLE_KEYWORDS = Collections.unmodifiableMap(table);

        Map<String, Double> column = new LinkedHashMap<>();
        weight(column, 3.0, "ssn", "bsn", "social_security", "passport", "medical", "health", "diagnosis");
        weight(column, 2.8, "password", "token", "secret", "bank", "birth", "dob", "license");
        weight(column, 2.5, "id_number", "email", "phone", "salary", "income", "credit", "iban");
        weight(column, 2.2, "address");
        weight(column, 2.0, "age", "gender", "key");
        COLUMN_KEYWORDS = Collections.unmodifiableMap(column);
    }

    private static void weight(Map<String, Double> target, double weight, String... keywords) {
        for (String keyword : keywords) {
            target.put(keyword, weight);
        }
    }

    /**
     * Computes the priority of a table.
     * The table name sets a base of at least 1.0; the most sensitive column adds 30% of its weight.
     *
     * @param tableName Table name
     * @param columns Columns of the table
     * @return Score between 0.0 and 3.5
     */
    public double scoreTable(String tableName, List<ColumnDescriptor> columns) {
        double base = BASE_SCORE;
        String name = tableName != null ? tableName.toLowerCase(Locale.ROOT) : "";
        for (Map.Entry<String, Double> entry : TABLE_KEYWORDS.entrySet()) {
            if (name.contains(entry.getKey())) {
                base = Math.max(base, entry.getValue());
            }
        }

        double maxColWeight = 0.0;
        if (columns != null) {
            for (ColumnDescriptor column : columns) {
                maxColWeight = Math.max(maxColWeight, scoreColumn(column.getName()));
            }
        }

        return Math.min(base + maxColWeight * COLUMN_BOOST_FACTOR, MAX_SCORE);
    }

    /**
     * Computes the sensitivity weight of a column name.
     *
     * @param columnName Column name
     * @return Highest matching keyword weight, 0 when nothing matches
     */
    public double scoreColumn(String columnName) {
        if (columnName == null) {
            return 0.0;
        }
        String name = columnName.toLowerCase(Locale.ROOT);
        double best = 0.0;
        for (Map.Entry<String, Double> entry : COLUMN_KEYWORDS.entrySet()) {
            if (name.contains(entry.getKey())) {
                best = Math.max(best, entry.getValue());
            }
        }
        return best;
    }

    /**
     * Returns a copy of the table with its priority score attached.
     *
     * @param table Table
     * @return Scored table
     */
    public TableDescriptor score(TableDescriptor table) {
        return table.withPriorityScore(scoreTable(table.getName(), table.getColumns()));
    }
}
