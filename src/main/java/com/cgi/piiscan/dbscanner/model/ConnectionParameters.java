package com.cgi.piiscan.dbscanner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

/**
 * Uniform, immutable connection parameters for every supported engine.
 * Owned by the caller; the scanner only reads them.
 */
@Value
@Builder(toBuilder = true)
@ToString(exclude = "password")
public class ConnectionParameters {
    @NonNull
    EngineKind engine;

    String host;

    /**
     * Port, or null to use the engine default.
     */
    Integer port;

    /**
     * Database name, SQLite file path or Redis database index.
     */
    String database;

    String username;

    String password;

    TlsSettings tls;

    /**
     * Additional driver properties passed through untouched.
     */
    @Singular
    Map<String, String> properties;

    /**
     * Gets the port to connect to, falling back to the engine default.
     *
     * @return Effective port
     */
    public int getEffectivePort() {
        return port != null ? port : engine.getDefaultPort();
    }

    /**
     * Whether TLS was requested.
     *
     * @return true if TLS settings are present and enabled
     */
    public boolean isTlsEnabled() {
        return tls != null && tls.isEnabled();
    }

    /**
     * Identifies the scanned database without exposing credentials.
     *
     * @return engine://host:port/database
     */
    public String describe() {
        if (engine == EngineKind.SQLITE) {
            return engine.getId() + "://" + database;
        }
        return engine.getId() + "://" + host + ":" + getEffectivePort() + "/" + (database != null ? database : "");
    }
}
