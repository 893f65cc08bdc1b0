package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects payment card numbers (13 to 19 digits, optionally grouped) that pass the Luhn check.
 */
@Component
public class CreditCardDetector extends AbstractPatternDetector {
    private static final Pattern CARD_PATTERN = Pattern.compile("\\b(?:\\d[ -]?){12,18}\\d\\b");

    public CreditCardDetector() {
        super(PIIType.CREDIT_CARD, CARD_PATTERN, Severity.CRITICAL, 0.9, "PCI DSS Req. 3");
    }

    @Override
    protected boolean quickCheck(String value) {
        return value.length() >= 13;
    }

    @Override
    protected boolean isValid(String candidate) {
        String digits = digitsOnly(candidate);
        return digits.length() >= 13 && digits.length() <= 19 && passesLuhn(digits);
    }

    /**
     * Luhn mod-10 check.
     *
     * @param digits Digits only
     * @return true if the check digit matches
     */
    public static boolean passesLuhn(String digits) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int d = digits.charAt(i) - '0';
            if (doubleIt) {
                d *= 2;
                if (d > 9) {
                    d -= 9;
                }
            }
            sum += d;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }
}
