package com.qualitysentinel.core.algorithms;

import com.qualitysentinel.core.model.Baseline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScore}.
 */
class ZScoreTest {

    @Test
    @DisplayName("Zero spread yields a zero score, never an anomaly")
    void shouldReturnZeroForFlatBaseline() {
        ZScore.Result result = ZScore.detect(250, baseline(100, 0));

        assertThat(result.getZScore()).isZero();
        assertThat(result.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should flag a value far below the mean")
    void shouldFlagLowOutlier() {
        ZScore.Result result = ZScore.detect(80, baseline(95, 2));

        assertThat(result.getZScore()).isCloseTo(-7.5, within(1e-9));
        assertThat(result.isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should accept a value close to the mean")
    void shouldAcceptNearMean() {
        ZScore.Result result = ZScore.detect(93, baseline(95, 5));

        assertThat(result.getZScore()).isCloseTo(-0.4, within(1e-9));
        assertThat(result.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Modified score is zero when the MAD is zero")
    void shouldGuardZeroMad() {
        assertThat(ZScore.modified(500, new double[] {7, 7, 7, 7, 7})).isZero();
        assertThat(ZScore.modified(1, new double[0])).isZero();
    }

    private static Baseline baseline(double mean, double stdDev) {
        return Baseline.builder()
                .mean(mean)
                .stdDev(stdDev)
                .min(mean - 3 * stdDev)
                .max(mean + 3 * stdDev)
                .sampleCount(30)
                .lastUpdated(Instant.EPOCH)
                .build();
    }
}
