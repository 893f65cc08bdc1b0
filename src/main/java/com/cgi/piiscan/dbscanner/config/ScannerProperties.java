package com.cgi.piiscan.dbscanner.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for scans.
 * Maps to properties with the prefix "dbscanner.scan" in the application properties.
 */
@Component
@ConfigurationProperties(prefix = "dbscanner.scan")
@Getter
@Setter
public class ScannerProperties {
    /**
     * Wall-clock budget of the parallel sampling phase.
     */
    private Duration maxScanTime = Duration.ofSeconds(300);

    /**
     * Time a single table may spend sampling and detecting before it is skipped.
     */
    private Duration tableTimeout = Duration.ofSeconds(60);

    /**
     * Connection establishment timeout for every engine.
     */
    private Duration connectTimeout = Duration.ofSeconds(15);

    /**
     * Documents read per collection to approximate its fields.
     */
    private int introspectionSampleDocuments = 5;

    /**
     * Maximum number of keys walked when introspecting a key-value store.
     */
    private int keyScanLimit = 10000;

    /**
     * Whether introspected schemas are cached between scans.
     */
    private boolean schemaCacheEnabled = false;
}
