package com.cgi.piiscan.piidetector.model;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One detected instance of sensitive data.
 * Detectors produce findings without a location; the scan engine attaches table and column.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Finding {
    PIIType type;

    String tableName;

    /**
     * Column (field, hash field) the value came from, if applicable.
     */
    String columnName;

    /**
     * Masked representation of the matched value; raw values never leave the scanner.
     */
    String maskedValue;

    double confidence;

    Severity severity;

    /**
     * Regulatory reference, e.g. "GDPR Art. 9 / UAVG Art. 46".
     */
    String regulatoryReference;

    /**
     * Name of the detector that produced the finding.
     */
    String detector;

    /**
     * Returns a copy of this finding located at the given table and column.
     *
     * @param table Table name
     * @param column Column name
     * @return Located finding
     */
    public Finding locatedAt(String table, String column) {
        return toBuilder().tableName(table).columnName(column).build();
    }
}
