package com.qualitysentinel.core.algorithms;

import com.qualitysentinel.core.model.DataPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MovingAverage}.
 */
class MovingAverageTest {

    private static final double[] HISTORY = {10, 12, 10, 12, 10, 12, 10, 12, 10, 12};

    @Test
    @DisplayName("Should flag a value far from the trailing average")
    void shouldFlagSpike() {
        MovingAverage.Result result = MovingAverage.detect(30, HISTORY);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getMovingAverage()).isCloseTo(11, within(1e-9));
        assertThat(result.getDeviation()).isCloseTo(19, within(1e-9));
        assertThat(result.getZScore()).isCloseTo(19, within(1e-9));
        assertThat(result.getPercentageDeviation()).isCloseTo(19.0 / 11 * 100, within(1e-9));
    }

    @Test
    @DisplayName("Should accept a value within the trailing spread")
    void shouldAcceptValueInsideSpread() {
        MovingAverage.Result result = MovingAverage.detect(12, HISTORY);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getZScore()).isCloseTo(1, within(1e-9));
    }

    @Test
    @DisplayName("Exponential mode compares against the EMA of the history")
    void shouldUseExponentialAverage() {
        MovingAverage.Result result = MovingAverage.detect(30, HISTORY, 10, 2.0, true, 0.5);

        assertThat(result.getMovingAverage()).isCloseTo(11.33203125, within(1e-9));
        assertThat(result.isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Empty history is never anomalous")
    void shouldIgnoreEmptyHistory() {
        MovingAverage.Result result = MovingAverage.detect(42, new double[0]);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getMovingAverage()).isEqualTo(42);
    }

    @Test
    @DisplayName("Bollinger scan reports only the point outside the bands")
    void shouldFlagPointOutsideBands() {
        List<DataPoint> data = alternating(20);
        data.add(DataPoint.of(20_000L, 40));

        List<AnomalyPoint> points = MovingAverage.detectBollinger(data, 20, 2.0);

        assertThat(points).hasSize(1);
        assertThat(points.get(0).getIndex()).isEqualTo(20);
        assertThat(points.get(0).getValue()).isEqualTo(40);
        assertThat(points.get(0).getTimestamp()).isEqualTo(20_000L);
        assertThat(points.get(0).getDeviation()).isPositive();
    }

    @Test
    @DisplayName("Bollinger scan is quiet for a steady series")
    void shouldStayQuietInsideBands() {
        assertThat(MovingAverage.detectBollinger(alternating(21), 20, 2.0)).isEmpty();
    }

    private static List<DataPoint> alternating(int n) {
        List<DataPoint> data = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            data.add(DataPoint.of(i * 1000L, i % 2 == 0 ? 10 : 12));
        }
        return data;
    }
}
