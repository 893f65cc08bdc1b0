package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessRegistrationNumberDetectorTest {

    private final BusinessRegistrationNumberDetector detector = new BusinessRegistrationNumberDetector();

    @Test
    void reportsEightDigitNumbersWithLowConfidence() {
        assertThat(detector.detect("KvK 69599084"))
                .singleElement()
                .satisfies(finding -> {
                    assertThat(finding.getType()).isEqualTo(PIIType.BUSINESS_REGISTRATION);
                    assertThat(finding.getConfidence()).isLessThan(0.5);
                });
    }

    @Test
    void ignoresOtherLengths() {
        assertThat(detector.detect("1234567")).isEmpty();
        assertThat(detector.detect("123456789")).isEmpty();
    }
}
