package com.qualitysentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MovingAverageDetector}.
 */
class MovingAverageDetectorTest {

    private static final double[] HISTORY = {10, 10, 10, 10, 10, 12, 10, 10, 10, 10};

    private final MovingAverageDetector detector = new MovingAverageDetector();

    @Test
    @DisplayName("Should flag a jump away from the trailing average")
    void shouldFlagJump() {
        Verdict verdict = detector.detect(30, new DetectionContext("m", null, HISTORY, 3));

        assertThat(verdict.isAnomaly()).isTrue();
        assertThat(verdict.getExpectedValue()).isCloseTo(10.2, within(1e-9));
        assertThat(verdict.getDeviation()).isCloseTo(33.0, within(1e-6));
    }

    @Test
    @DisplayName("Should accept a value near the trailing average")
    void shouldAcceptNearAverage() {
        Verdict verdict = detector.detect(10.5, new DetectionContext("m", null, HISTORY, 3));

        assertThat(verdict.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Needs a full window of history")
    void shouldRequireWindow() {
        assertThat(detector.canRun(new DetectionContext("m", null, new double[9], 3))).isFalse();
        assertThat(detector.canRun(new DetectionContext("m", null, HISTORY, 3))).isTrue();
    }
}
