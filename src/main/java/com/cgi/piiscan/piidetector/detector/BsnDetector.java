package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects Dutch citizen service numbers (BSN).
 * A nine-digit candidate is only reported when it passes the 11-proof.
 */
@Component
public class BsnDetector extends AbstractPatternDetector {
    private static final Pattern BSN_PATTERN = Pattern.compile("\\b\\d{9}\\b");

    public BsnDetector() {
        super(PIIType.NATIONAL_ID, BSN_PATTERN, Severity.CRITICAL, 0.95, "GDPR Art. 9 / UAVG Art. 46");
    }

    @Override
    protected boolean isValid(String candidate) {
        return passesElevenProof(candidate);
    }

    /**
     * Checks sum(d[i] * (9 - i), i = 0..7) - d[8] is divisible by 11.
     *
     * @param bsn Nine digits
     * @return true if the number is a valid BSN
     */
    public static boolean passesElevenProof(String bsn) {
        if (bsn == null || bsn.length() != 9) {
            return false;
        }
        int sum = 0;
        for (int i = 0; i < 8; i++) {
            char c = bsn.charAt(i);
            if (!Character.isDigit(c)) {
                return false;
            }
            sum += (c - '0') * (9 - i);
        }
        char last = bsn.charAt(8);
        if (!Character.isDigit(last)) {
            return false;
        }
        sum -= last - '0';
        return sum % 11 == 0;
    }
}
