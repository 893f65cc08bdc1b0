package com.cgi.piiscan.dbscanner.service.cache;

import com.cgi.piiscan.dbscanner.model.IntrospectionResult;

import java.util.Optional;

/**
 * Cache that never stores anything; every scan introspects the live schema.
 */
public class NoOpSchemaCache implements SchemaCache {

    @Override
    public Optional<IntrospectionResult> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, IntrospectionResult result) {
    }
}
