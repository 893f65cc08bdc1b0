package com.cgi.piiscan.dbscanner.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * TLS options for a database connection.
 */
@Value
@Builder
@ToString(exclude = "trustStorePassword")
public class TlsSettings {
    /**
     * Whether the connection must be encrypted.
     */
    boolean enabled;

    /**
     * Engine-specific SSL mode (disable, require, verify-ca, verify-full).
     */
    String mode;

    /**
     * Path to the trust store holding the server CA.
     */
    String trustStorePath;

    String trustStorePassword;

    public static TlsSettings disabled() {
        return TlsSettings.builder().enabled(false).build();
    }
}
