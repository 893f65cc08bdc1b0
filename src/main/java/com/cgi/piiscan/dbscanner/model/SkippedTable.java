package com.cgi.piiscan.dbscanner.model;

import lombok.Value;

/**
 * A selected table whose scan produced no result.
 */
@Value
public class SkippedTable {

    public enum Reason {
        TIMEOUT,
        ERROR,
        BUDGET_EXHAUSTED,
        INTERRUPTED
    }

    String tableName;
    Reason reason;
    String detail;
}
