package com.qualitysentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create ZScoreDetector for zscore")
    void shouldCreateZScoreDetector() {
        assertThat(DetectorFactory.create(Algorithm.ZSCORE)).isInstanceOf(ZScoreDetector.class);
    }

    @Test
    @DisplayName("Should create IqrDetector with the default multiplier")
    void shouldCreateIqrDetector() {
        AnomalyDetector detector = DetectorFactory.create(Algorithm.fromId("iqr"));

        assertThat(detector).isInstanceOf(IqrDetector.class);
        assertThat(((IqrDetector) detector).getMultiplier()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Should return detectors in precedence order regardless of input order")
    void shouldOrderByAlgorithm() {
        Set<Algorithm> requested = new LinkedHashSet<>(
                List.of(Algorithm.MOVING_AVERAGE, Algorithm.ZSCORE, Algorithm.IQR));

        List<AnomalyDetector> detectors = DetectorFactory.createAll(requested);

        assertThat(detectors).extracting(AnomalyDetector::algorithm)
                .containsExactly(Algorithm.ZSCORE, Algorithm.IQR, Algorithm.MOVING_AVERAGE);
        assertThatThrownBy(() -> detectors.add(new ZScoreDetector()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Empty selection creates no detectors")
    void shouldHandleEmptySelection() {
        assertThat(DetectorFactory.createAll(EnumSet.noneOf(Algorithm.class))).isEmpty();
    }

    @Test
    @DisplayName("Should throw for unknown algorithm id")
    void shouldThrowForUnknownAlgorithm() {
        assertThatThrownBy(() -> Algorithm.fromId("fourier"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown algorithm");
    }
}
