package com.qualitysentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IqrDetector}.
 */
class IqrDetectorTest {

    private static final double[] HISTORY = {10, 12, 14, 16, 18, 20, 22, 24};

    @Test
    @DisplayName("Should flag values outside the fences and report the median")
    void shouldFlagOutsideFences() {
        IqrDetector detector = new IqrDetector();
        DetectionContext context = new DetectionContext("m", null, HISTORY, 3);

        Verdict high = detector.detect(40, context);
        Verdict inside = detector.detect(20, context);

        assertThat(high.isAnomaly()).isTrue();
        assertThat(high.getExpectedValue()).isEqualTo(17);
        assertThat(inside.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("A wider multiplier moves the fences out")
    void shouldUseMultiplier() {
        IqrDetector detector = new IqrDetector(3.0);

        // upper fence 22 + 3 * 8 = 46
        assertThat(detector.detect(40, new DetectionContext("m", null, HISTORY, 3)).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Needs at least four historical points")
    void shouldRequireHistory() {
        assertThat(new IqrDetector().canRun(new DetectionContext("m", null, new double[] {1, 2, 3}, 3))).isFalse();
    }
}
