package com.cgi.piiscan.dbscanner.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the Spring cache abstraction. The "schemaMetadata" cache is only read when
 * {@code dbscanner.scan.schema-cache-enabled} is set.
 */
@Configuration
@EnableCaching
public class CacheConfig {
}
