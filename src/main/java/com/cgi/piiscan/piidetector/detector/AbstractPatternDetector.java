/*
 * AbstractPatternDetector.java - Base detector combining a regex with an optional validator
 */
package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.api.PIIDetector;
import com.cgi.piiscan.piidetector.model.Finding;
import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base detector: finds candidates with a regular expression, then lets subclasses
 * validate each candidate before it becomes a finding.
 */
public abstract class AbstractPatternDetector implements PIIDetector {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final PIIType type;
    private final Pattern pattern;
    private final Severity severity;
    private final double confidence;
    private final String regulatoryReference;

    protected AbstractPatternDetector(PIIType type, Pattern pattern, Severity severity,
                                      double confidence, String regulatoryReference) {
        this.type = type;
        this.pattern = pattern;
        this.severity = severity;
        this.confidence = confidence;
        this.regulatoryReference = regulatoryReference;
    }

    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    @Override
    public PIIType getType() {
        return type;
    }

    @Override
    public List<Finding> detect(String value) {
        if (value == null || value.isBlank() || !quickCheck(value)) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        Matcher matcher = pattern.matcher(value);
        while (matcher.find()) {
            String candidate = matcher.group();
            if (isValid(candidate)) {
                findings.add(createFinding(candidate));
            }
        }
        return findings;
    }

    /**
     * Cheap pre-filter applied before the regex.
     *
     * @param value Raw value
     * @return false to skip the value entirely
     */
    protected boolean quickCheck(String value) {
        return true;
    }

    /**
     * Validates a regex match. Matches that fail validation are discarded.
     *
     * @param candidate Matched text
     * @return true if the match is a real identifier
     */
    protected boolean isValid(String candidate) {
        return true;
    }

    /**
     * Creates a finding for a validated match.
     *
     * @param match Matched text
     * @return Finding without location
     */
    protected Finding createFinding(String match) {
        return Finding.builder()
                .type(type)
                .maskedValue(mask(match))
                .confidence(confidence)
                .severity(severity)
                .regulatoryReference(regulatoryReference)
                .detector(getName())
                .build();
    }

    /**
     * Masks a value, keeping only its last characters.
     *
     * @param value Value to mask
     * @return Masked value
     */
    static String mask(String value) {
        String compact = value.strip();
        int visible = compact.length() > 8 ? 4 : 2;
        if (compact.length() <= visible) {
            return "*".repeat(compact.length());
        }
        return "*".repeat(compact.length() - visible) + compact.substring(compact.length() - visible);
    }

    /**
     * Keeps only the digits of a value.
     *
     * @param value Value
     * @return Digits
     */
    static String digitsOnly(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
