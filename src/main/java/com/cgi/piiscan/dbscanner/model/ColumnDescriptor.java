package com.cgi.piiscan.dbscanner.model;

import lombok.Value;

/**
 * Column name and declared type as reported by the engine.
 */
@Value
public class ColumnDescriptor {
    String name;
    String type;

    public static ColumnDescriptor of(String name, String type) {
        return new ColumnDescriptor(name, type);
    }
}
