package com.qualitysentinel.core.config;

import com.qualitysentinel.core.alert.AlertConfig;
import com.qualitysentinel.core.baseline.BaselineMethod;
import com.qualitysentinel.core.detection.Algorithm;
import com.qualitysentinel.core.engine.DetectionConfig;
import com.qualitysentinel.core.engine.Sensitivity;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SentinelConfigLoader}.
 */
class SentinelConfigLoaderTest {

    @Test
    @DisplayName("Should load test-sentinel.yml from classpath")
    void shouldLoadFromClasspath() {
        SentinelConfig config = SentinelConfigLoader.fromClasspath("test-sentinel.yml");

        DetectionConfig detection = config.toDetectionConfig();
        assertThat(detection.getAlgorithms()).containsExactly(Algorithm.ZSCORE, Algorithm.IQR);
        assertThat(detection.getSensitivity()).isEqualTo(Sensitivity.HIGH);
        assertThat(detection.getMinDataPoints()).isEqualTo(5);

        AlertConfig alert = config.toAlertConfig();
        assertThat(alert.getMinSeverity()).isEqualTo(Severity.LOW);
        assertThat(alert.getDeduplicationWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(alert.getMaxAlertsPerWindow()).isEqualTo(3);
        // untouched keys keep their defaults
        assertThat(alert.getCooldownPeriod()).isEqualTo(Duration.ofMinutes(30));

        assertThat(config.toBaselineConfig().getCalculationMethod()).isEqualTo(BaselineMethod.MEDIAN);
        assertThat(config.toBaselineConfig().getWindowSize()).isEqualTo(14);
    }

    @Test
    @DisplayName("Should load the bundled defaults")
    void shouldLoadBundledDefaults() {
        SentinelConfig config = SentinelConfigLoader.fromClasspath(SentinelConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.toDetectionConfig().getAlgorithms()).containsExactly(Algorithm.values());
        assertThat(config.toAlertConfig().getMinSeverity()).isEqualTo(Severity.LOW);
        assertThat(config.toDetectionConfig().getThreshold()).isEqualTo(Sensitivity.MEDIUM.getThreshold());
        assertThat(config.toSeverityWeights().typeMultiplier(AnomalyType.FAILURE_SPIKE)).isEqualTo(1.3);
        assertThat(config.getStorage().getTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Should carry thresholds, window and baseline age into the typed configs")
    void shouldApplyTunedSettings() {
        SentinelConfig config = SentinelConfigLoader.fromString(
                "detection:\n  detectionWindowDays: 14\n  thresholds:\n    zscore: 5.0\n"
                        + "baseline:\n  maxAgeHours: 6\n"
                        + "storage:\n  maxAnomalies: 500\n");

        assertThat(config.toDetectionConfig().getThreshold()).isEqualTo(5.0);
        assertThat(config.getDetection().getDetectionWindow()).isEqualTo(Duration.ofDays(14));
        assertThat(config.getBaseline().getMaxAge()).isEqualTo(Duration.ofHours(6));
        assertThat(config.getStorage().getMaxAnomalies()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should reject a non-positive z-score threshold")
    void shouldRejectZeroZScore() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromString("detection:\n  thresholds:\n    zscore: 0.0\n"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detection.thresholds.zscore must be > 0");
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("invalid-sentinel.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Sentinel configuration validation failed")
                .hasMessageContaining("detection.algorithms")
                .hasMessageContaining("detection.sensitivity")
                .hasMessageContaining("alert.maxAlertsPerWindow must be >= 1");
    }

    @Test
    @DisplayName("Should throw for missing classpath resource")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("nonexistent.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw for missing file")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromFile("/nonexistent/sentinel.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("An empty document yields the defaults")
    void shouldDefaultEmptyDocument() {
        SentinelConfig config = SentinelConfigLoader.fromString("");

        assertThat(config.toDetectionConfig().getMinDataPoints()).isEqualTo(DetectionConfig.DEFAULT_MIN_DATA_POINTS);
        assertThat(config.toAlertConfig().getDeduplicationWindow()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Unknown anomaly types in severity multipliers are rejected")
    void shouldRejectUnknownMultiplierType() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromString("severity:\n  typeMultipliers:\n    bogus: 2.0\n"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unknown anomaly type 'bogus'");
    }
}
