package com.cgi.piiscan.dbscanner.model;

/**
 * Caller-selected scan depth.
 */
public enum ScanMode {
    FAST,
    SMART,
    DEEP
}
