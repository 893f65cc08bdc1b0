package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Detects Dutch postal codes (four digits, optional space, two letters).
 */
@Component
public class PostalCodeDetector extends AbstractPatternDetector {
    private static final Pattern POSTAL_CODE_PATTERN = Pattern.compile("\\b[1-9]\\d{3}\\s?[A-Z]{2}\\b");

    // Letter combinations PostNL never issues
    private static final Set<String> EXCLUDED_SUFFIXES = Set.of("SA", "SD", "SS");

    public PostalCodeDetector() {
        super(PIIType.POSTAL_CODE, POSTAL_CODE_PATTERN, Severity.LOW, 0.7, null);
    }

    @Override
    protected boolean isValid(String candidate) {
        String letters = candidate.substring(candidate.length() - 2);
        return !EXCLUDED_SUFFIXES.contains(letters);
    }
}
