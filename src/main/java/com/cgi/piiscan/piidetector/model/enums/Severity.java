package com.cgi.piiscan.piidetector.model.enums;

/**
 * Severity of a finding, ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
