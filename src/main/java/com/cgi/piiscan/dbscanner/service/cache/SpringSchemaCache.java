package com.cgi.piiscan.dbscanner.service.cache;

import com.cgi.piiscan.dbscanner.model.IntrospectionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Schema cache backed by the Spring cache named "schemaMetadata".
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "dbscanner.scan", name = "schema-cache-enabled", havingValue = "true")
public class SpringSchemaCache implements SchemaCache {
    static final String CACHE_NAME = "schemaMetadata";

    private final CacheManager cacheManager;

    public SpringSchemaCache(CacheManager cacheManager) {
        this.cacheManager = cacheManager;
        log.info("Schema cache enabled using {}", cacheManager.getClass().getSimpleName());
    }

    @Override
    public Optional<IntrospectionResult> get(String key) {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache == null) {
            return Optional.empty();
        }
        IntrospectionResult cached = cache.get(key, IntrospectionResult.class);
        if (cached != null) {
            log.debug("Schema cache hit for {}", key);
        }
        return Optional.ofNullable(cached);
    }

    @Override
    public void put(String key, IntrospectionResult result) {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache != null) {
            cache.put(key, result);
        }
    }
}
