package com.cgi.piiscan.dbscanner.model;

/**
 * Sampling strategies the selector can choose from.
 */
public enum StrategyKind {
    COMPREHENSIVE,
    PRIORITY,
    PRIORITY_DEEP,
    SAMPLING
}
