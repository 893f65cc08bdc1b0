package com.cgi.piiscan.dbscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Database-wide view of the introspected schema, computed once per scan.
 */
@Value
@Builder
public class SchemaAnalysis {
    @JsonIgnore
    List<TableDescriptor> tables;

    int totalTables;

    long estimatedRows;

    int highPriorityTables;

    int mediumPriorityTables;

    int lowPriorityTables;

    double riskScore;

    RiskLevel riskLevel;
}
