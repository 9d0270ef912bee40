package com.qualitysentinel.core.algorithms;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Iqr}.
 */
class IqrTest {

    private static final double[] HISTORY = {10, 12, 14, 16, 18, 20, 22, 24};

    @Test
    @DisplayName("Fences sit 1.5 IQR outside the quartiles")
    void shouldComputeFences() {
        IqrStats stats = Iqr.stats(HISTORY);

        assertThat(stats.getQ1()).isEqualTo(14);
        assertThat(stats.getQ3()).isEqualTo(22);
        assertThat(stats.getLowerBound()).isEqualTo(2);
        assertThat(stats.getUpperBound()).isEqualTo(34);
    }

    @Test
    @DisplayName("Should flag a high outlier with a positive deviation")
    void shouldFlagHigh() {
        Iqr.Result result = Iqr.detect(40, HISTORY);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.isHigh()).isTrue();
        assertThat(result.getDeviation()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("Should flag a low outlier with a negative deviation")
    void shouldFlagLow() {
        Iqr.Result result = Iqr.detect(-5, HISTORY);

        assertThat(result.isLow()).isTrue();
        assertThat(result.getDeviation()).isCloseTo(-0.875, within(1e-9));
    }

    @Test
    @DisplayName("Values inside the fences are normal")
    void shouldAcceptInside() {
        Iqr.Result result = Iqr.detect(20, HISTORY);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getDeviation()).isZero();
    }

    @Test
    @DisplayName("Fences work on short integer series")
    void shouldFlagAgainstShortSeries() {
        Iqr.Result high = Iqr.detect(100, new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10});
        Iqr.Result low = Iqr.detect(-10, new double[] {10, 11, 12, 13, 14, 15});

        assertThat(high.isAnomaly()).isTrue();
        assertThat(high.isHigh()).isTrue();
        assertThat(low.isLow()).isTrue();
        assertThat(low.isHigh()).isFalse();
    }
}
