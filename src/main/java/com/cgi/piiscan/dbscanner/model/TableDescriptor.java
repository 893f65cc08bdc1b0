package com.cgi.piiscan.dbscanner.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * A discovered table, collection or key space.
 * Read-only once introspection is done; the priority score is attached with {@link #withPriorityScore(double)}.
 */
@Value
@Builder
public class TableDescriptor {
    String name;

    /**
     * Row (document, key) count estimate from the engine statistics.
     */
    long estimatedRowCount;

    @Singular
    List<ColumnDescriptor> columns;

    /**
     * Sensitivity priority between 0.0 and 3.5.
     */
    @With
    double priorityScore;

    /**
     * Gets the column names in declaration order.
     *
     * @return Column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDescriptor::getName).toList();
    }
}
