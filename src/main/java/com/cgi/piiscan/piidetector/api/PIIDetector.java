package com.cgi.piiscan.piidetector.api;

import com.cgi.piiscan.piidetector.model.Finding;
import com.cgi.piiscan.piidetector.model.enums.PIIType;

import java.util.List;

/**
 * Detects one kind of personal data in a single cell value.
 * Implementations must be stateless so workers can share them without synchronization.
 */
public interface PIIDetector {
    /**
     * Unique name of the detector.
     *
     * @return Detector name
     */
    String getName();

    /**
     * Type of PII this detector reports.
     *
     * @return PII type
     */
    PIIType getType();

    /**
     * Scans a value for occurrences of this detector's PII type.
     * Returned findings carry no table or column.
     *
     * @param value Cell value rendered as text
     * @return Findings, empty if nothing matched
     */
    List<Finding> detect(String value);
}
