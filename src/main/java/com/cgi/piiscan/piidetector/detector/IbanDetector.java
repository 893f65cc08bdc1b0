package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import com.cgi.piiscan.piidetector.model.enums.Severity;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects IBAN bank account numbers validated with the ISO 13616 mod-97 check.
 */
@Component
public class IbanDetector extends AbstractPatternDetector {
    private static final Pattern IBAN_PATTERN = Pattern.compile("\\b[A-Z]{2}\\d{2}[A-Z0-9]{11,30}\\b");

    public IbanDetector() {
        super(PIIType.BANK_ACCOUNT, IBAN_PATTERN, Severity.HIGH, 0.9, "GDPR Art. 4(1)");
    }

    @Override
    protected boolean isValid(String candidate) {
        return hasValidChecksum(candidate);
    }

    /**
     * Moves the first four characters to the end, maps letters to 10..35 and
     * checks the resulting number modulo 97 equals 1.
     *
     * @param iban IBAN without spaces
     * @return true if the checksum matches
     */
    public static boolean hasValidChecksum(String iban) {
        if (iban == null || iban.length() < 15) {
            return false;
        }
        String rearranged = iban.substring(4) + iban.substring(0, 4);
        int remainder = 0;
        for (int i = 0; i < rearranged.length(); i++) {
            int value = Character.digit(rearranged.charAt(i), 36);
            if (value < 0) {
                return false;
            }
            remainder = value < 10
                    ? (remainder * 10 + value) % 97
                    : (remainder * 100 + value) % 97;
        }
        return remainder == 1;
    }
}
