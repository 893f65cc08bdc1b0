package com.cgi.piiscan.dbscanner.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a schema introspection: the tables that could be described and the ones that failed.
 */
@Value
public class IntrospectionResult {
    List<TableDescriptor> tables;
    List<IntrospectionFailure> failures;

    public IntrospectionResult(List<TableDescriptor> tables, List<IntrospectionFailure> failures) {
        this.tables = List.copyOf(tables);
        this.failures = List.copyOf(failures);
    }

    public static IntrospectionResult empty() {
        return new IntrospectionResult(List.of(), List.of());
    }
}
