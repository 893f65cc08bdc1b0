package com.cgi.piiscan.dbscanner.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Represents a sample of rows from a table, collection or key space.
 */
@Getter
@Builder
@ToString
public class DataSample {

    /**
     * Name of the table.
     */
    private final String tableName;

    /**
     * List of column names.
     */
    private final List<String> columnNames;

    /**
     * List of rows, where each row is a map of column name to value.
     */
    private final List<Map<String, Object>> rows;

    /**
     * Creates a data sample from a list of rows.
     * Column names are taken from the first row.
     *
     * @param tableName Table name
     * @param rows List of rows
     * @return Data sample
     */
    public static DataSample fromRows(String tableName, List<Map<String, Object>> rows) {
        return DataSample.builder()
                .tableName(tableName)
                .rows(rows)
                .columnNames(rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).keySet()))
                .build();
    }

    /**
     * Number of rows in this sample.
     *
     * @return Row count
     */
    public int getSampleSize() {
        return rows.size();
    }
}
