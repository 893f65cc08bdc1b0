package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects Dutch phone numbers in national (06-12345678) or international
 * (+31 6 12345678, 0031612345678) notation.
 */
@Component
public class PhoneNumberDetector extends AbstractPatternDetector {
    private static final Pattern PHONE_PATTERN =
            Pattern.compile("(?<![\\w+])(?:\\+31|0031|0)[\\s-]?(?:\\d[\\s-]?){8}\\d(?!\\d)");

    public PhoneNumberDetector() {
        super(PIIType.PHONE_NUMBER, PHONE_PATTERN, Severity.MEDIUM, 0.8, null);
    }

    @Override
    protected boolean quickCheck(String value) {
        // At least ten digits are needed for the shortest notation
        int digits = 0;
        for (int i = 0; i < value.length() && digits < 10; i++) {
            if (Character.isDigit(value.charAt(i))) {
                digits++;
            }
        }
        return digits >= 10;
    }
}
