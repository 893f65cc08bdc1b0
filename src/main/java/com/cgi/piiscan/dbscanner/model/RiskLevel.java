package com.cgi.piiscan.dbscanner.model;

/**
 * Database-wide risk classification.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
