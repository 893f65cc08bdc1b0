package com.cgi.piiscan.piidetector.detector;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AbstractPatternDetectorTest {

    @Test
    void masksAllButLastFourOfLongValues() {
        assertThat(AbstractPatternDetector.mask("NL91ABNA0417164300")).isEqualTo("**************4300");
    }

    @Test
    void masksAllButLastTwoOfShortValues() {
        assertThat(AbstractPatternDetector.mask("1012 LG")).isEqualTo("*****LG");
        assertThat(AbstractPatternDetector.mask("AB")).isEqualTo("**");
    }

    @Test
    void digitsOnlyDropsSeparators() {
        assertThat(AbstractPatternDetector.digitsOnly("4111 1111-1111")).isEqualTo("411111111111");
    }
}
