package com.cgi.piiscan.dbscanner.model;

/**
 * Database engines the scanner can connect to.
 */
public enum EngineKind {
    POSTGRESQL("postgresql", 5432, true),
    MYSQL("mysql", 3306, true),
    MONGODB("mongodb", 27017, false),
    REDIS("redis", 6379, false),
    SQLITE("sqlite", 0, true),
    SQLSERVER("sqlserver", 1433, true);

    private final String id;
    private final int defaultPort;
    private final boolean relational;

    EngineKind(String id, int defaultPort, boolean relational) {
        this.id = id;
        this.defaultPort = defaultPort;
        this.relational = relational;
    }

    /**
     * Lower-case identifier used in logs and API payloads.
     */
    public String getId() {
        return id;
    }

    /**
     * Default network port, 0 for file-based engines.
     */
    public int getDefaultPort() {
        return defaultPort;
    }

    public boolean isRelational() {
        return relational;
    }
}
