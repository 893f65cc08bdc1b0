package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects Dutch Chamber of Commerce (KvK) numbers.
 * KvK numbers carry no checksum, so any standalone eight-digit run matches and
 * findings are reported with low confidence.
 */
@Component
public class BusinessRegistrationNumberDetector extends AbstractPatternDetector {
    private static final Pattern KVK_PATTERN = Pattern.compile("\\b\\d{8}\\b");

    public BusinessRegistrationNumberDetector() {
        super(PIIType.BUSINESS_REGISTRATION, KVK_PATTERN, Severity.MEDIUM, 0.4, null);
    }
}
