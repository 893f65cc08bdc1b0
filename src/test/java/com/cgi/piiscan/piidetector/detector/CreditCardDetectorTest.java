package com.cgi.piiscan.piidetector.detector;

import com.cgi.piiscan.piidetector.model.enums.PIIType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CreditCardDetectorTest {

    private final CreditCardDetector detector = new CreditCardDetector();

    @Test
    void luhnAcceptsKnownTestNumbers() {
        assertThat(CreditCardDetector.passesLuhn("4111111111111111")).isTrue();
        assertThat(CreditCardDetector.passesLuhn("5500005555555559")).isTrue();
        assertThat(CreditCardDetector.passesLuhn("4111111111111112")).isFalse();
    }

    @Test
    void detectsGroupedCardNumbers() {
        assertThat(detector.detect("card 4111 1111 1111 1111"))
                .singleElement()
                .satisfies(finding -> {
                    assertThat(finding.getType()).isEqualTo(PIIType.CREDIT_CARD);
                    assertThat(finding.getMaskedValue()).endsWith("1111");
                });
        assertThat(detector.detect("4111-1111-1111-1111")).hasSize(1);
    }

    @Test
    void ignoresNumbersFailingLuhn() {
        assertThat(detector.detect("4111111111111112")).isEmpty();
        assertThat(detector.detect("12345")).isEmpty();
    }
}
