package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.detection.Algorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionConfig} and {@link DetectionThresholds}.
 */
class DetectionConfigTest {

    @Test
    @DisplayName("Defaults enable every algorithm at medium sensitivity")
    void shouldHaveDefaults() {
        DetectionConfig config = DetectionConfig.defaults();

        assertThat(config.isEnabled()).isTrue();
        assertThat(config.getAlgorithms()).containsExactly(Algorithm.values());
        assertThat(config.getThreshold()).isEqualTo(3.0);
        assertThat(config.getMinDataPoints()).isEqualTo(10);
        assertThat(config.getThresholds().getConsecutiveFailures()).isEqualTo(3);
    }

    @Test
    @DisplayName("Sensitivity maps to the z-score threshold")
    void shouldMapSensitivity() {
        assertThat(DetectionConfig.builder().sensitivity(Sensitivity.HIGH).build().getThreshold()).isEqualTo(2.0);
        assertThat(Sensitivity.fromId(" Low ")).isEqualTo(Sensitivity.LOW);
        assertThatThrownBy(() -> Sensitivity.fromId("extreme"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Supported: low, medium, high");
    }

    @Test
    @DisplayName("An explicit z-score threshold overrides the sensitivity")
    void shouldPreferExplicitZScoreThreshold() {
        DetectionConfig config = DetectionConfig.builder()
                .sensitivity(Sensitivity.HIGH)
                .thresholds(DetectionThresholds.builder().zScore(5.0).build())
                .build();

        assertThat(config.getThreshold()).isEqualTo(5.0);
        assertThat(DetectionThresholds.defaults().getZScore()).isEmpty();
        assertThatThrownBy(() -> DetectionThresholds.builder().zScore(0.0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zScore");
    }

    @Test
    @DisplayName("toBuilder keeps every field")
    void shouldCopyThroughBuilder() {
        DetectionConfig original = DetectionConfig.builder()
                .algorithms(Algorithm.IQR)
                .minDataPoints(4)
                .build();

        DetectionConfig copy = original.toBuilder().build();

        assertThat(copy.getAlgorithms()).isEqualTo(Set.of(Algorithm.IQR));
        assertThat(copy.getMinDataPoints()).isEqualTo(4);
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> DetectionConfig.builder().algorithms(Set.of()).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one algorithm");
        assertThatThrownBy(() -> DetectionConfig.builder().minDataPoints(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectionThresholds.builder().flakyScore(1.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("flakyScore");
    }
}
