package com.cgi.piiscan.dbscanner.service.cache;

import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.IntrospectionResult;

import java.util.Optional;

/**
 * Stores introspected schemas between scans of the same database.
 */
public interface SchemaCache {

    Optional<IntrospectionResult> get(String key);

    void put(String key, IntrospectionResult result);

    /**
     * Builds the cache key of a database. Passwords never take part in the key.
     *
     * @param params Connection parameters
     * @return Cache key
     */
    static String keyFor(ConnectionParameters params) {
        return params.describe() + "|" + (params.getUsername() != null ? params.getUsername() : "");
    }
}
