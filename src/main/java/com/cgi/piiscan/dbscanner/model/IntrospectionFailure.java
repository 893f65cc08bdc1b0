package com.cgi.piiscan.dbscanner.model;

import lombok.Value;

/**
 * A table or collection that could not be introspected.
 */
@Value
public class IntrospectionFailure {
    String tableName;
    String reason;
}
