package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.model.Baseline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreDetector}.
 */
class ZScoreDetectorTest {

    private final ZScoreDetector detector = new ZScoreDetector();

    @Test
    @DisplayName("Should not run without a baseline")
    void shouldRequireBaseline() {
        DetectionContext context = new DetectionContext("m", null, new double[] {1, 2, 3}, 3);

        assertThat(detector.canRun(context)).isFalse();
    }

    @Test
    @DisplayName("Should report the baseline mean as the expected value")
    void shouldFlagOutlier() {
        Baseline baseline = Baseline.builder()
                .mean(100)
                .stdDev(2)
                .sampleCount(30)
                .lastUpdated(Instant.EPOCH)
                .build();
        DetectionContext context = new DetectionContext("m", baseline, null, 3);

        Verdict verdict = detector.detect(85, context);

        assertThat(detector.canRun(context)).isTrue();
        assertThat(verdict.isAnomaly()).isTrue();
        assertThat(verdict.getDeviation()).isCloseTo(-7.5, within(1e-9));
        assertThat(verdict.getExpectedValue()).isEqualTo(100);
        assertThat(verdict.getAlgorithm()).isEqualTo(Algorithm.ZSCORE);
    }

    @Test
    @DisplayName("A lower threshold flags smaller deviations")
    void shouldHonourThreshold() {
        Baseline baseline = Baseline.builder()
                .mean(100)
                .stdDev(2)
                .sampleCount(30)
                .lastUpdated(Instant.EPOCH)
                .build();

        assertThat(detector.detect(105, new DetectionContext("m", baseline, null, 3)).isAnomaly()).isFalse();
        assertThat(detector.detect(105, new DetectionContext("m", baseline, null, 2)).isAnomaly()).isTrue();
    }
}
