/*
 * DetectorSet.java - Composite of all registered PII detectors
 */
package com.cgi.piiscan.piidetector.service;

import com.cgi.piiscan.piidetector.api.PIIDetector;
import com.cgi.piiscan.piidetector.model.Finding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered detector against a value and merges their findings.
 * A detector that throws is ignored for that value; the others still contribute.
 */
@Slf4j
@Component
public class DetectorSet {
    private final List<PIIDetector> detectors;

    public DetectorSet(List<PIIDetector> detectors) {
        this.detectors = List.copyOf(detectors);
        log.info("Initialized detector set with {} detectors: {}", detectors.size(),
                detectors.stream().map(PIIDetector::getName).toList());
    }

    /**
     * Applies all detectors to a single value.
     *
     * @param value Cell value
     * @return Findings from all detectors, without location
     */
    public List<Finding> detect(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        for (PIIDetector detector : detectors) {
            try {
                findings.addAll(detector.detect(value));
            } catch (RuntimeException e) {
                log.debug("Detector {} failed on a value: {}", detector.getName(), e.getMessage());
            }
        }
        return findings;
    }

    /**
     * Applies all detectors to a cell and locates the findings at the given table and column.
     *
     * @param tableName Table name
     * @param columnName Column name
     * @param value Cell value, ignored when null
     * @return Located findings
     */
    public List<Finding> detect(String tableName, String columnName, Object value) {
        if (value == null) {
            return List.of();
        }
        List<Finding> raw = detect(String.valueOf(value));
        if (raw.isEmpty()) {
            return raw;
        }
        List<Finding> located = new ArrayList<>(raw.size());
        for (Finding finding : raw) {
            located.add(finding.locatedAt(tableName, columnName));
        }
        return located;
    }

    /**
     * Gets the registered detectors.
     *
     * @return Detectors
     */
    public List<PIIDetector> getDetectors() {
        return detectors;
    }
}
