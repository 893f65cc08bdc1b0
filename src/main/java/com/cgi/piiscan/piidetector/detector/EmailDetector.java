package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects e-mail addresses.
 */
@Component
public class EmailDetector extends AbstractPatternDetector {
    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("\\b[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}\\b");

    public EmailDetector() {
        super(PIIType.EMAIL, EMAIL_PATTERN, Severity.MEDIUM, 0.9, null);
    }

    @Override
    protected boolean quickCheck(String value) {
        return value.indexOf('@') > 0;
    }
}
