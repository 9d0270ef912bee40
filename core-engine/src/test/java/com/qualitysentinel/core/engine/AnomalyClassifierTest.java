package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.AnomalyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyClassifier}.
 */
class AnomalyClassifierTest {

    @Test
    @DisplayName("Timing metrics split on the deviation sign")
    void shouldClassifyTiming() {
        assertThat(AnomalyClassifier.classify("Login:Duration", 4)).isEqualTo(AnomalyType.DURATION_SPIKE);
        assertThat(AnomalyClassifier.classify("response_time", -4)).isEqualTo(AnomalyType.PERFORMANCE_DEGRADATION);
    }

    @Test
    @DisplayName("Keyword rules apply in order")
    void shouldApplyKeywordOrder() {
        assertThat(AnomalyClassifier.classify("error_count", -2)).isEqualTo(AnomalyType.FAILURE_SPIKE);
        assertThat(AnomalyClassifier.classify("pass_rate", -3)).isEqualTo(AnomalyType.SUCCESS_RATE_DROP);
        assertThat(AnomalyClassifier.classify("pass_rate", 3)).isEqualTo(AnomalyType.TREND_CHANGE);
        assertThat(AnomalyClassifier.classify("cpu_load", 3)).isEqualTo(AnomalyType.RESOURCE_ANOMALY);
        // "time" wins over "failure"
        assertThat(AnomalyClassifier.classify("failure_time", 3)).isEqualTo(AnomalyType.DURATION_SPIKE);
        assertThat(AnomalyClassifier.classify("queue_depth", 3)).isEqualTo(AnomalyType.DURATION_SPIKE);
    }

    @Test
    @DisplayName("Descriptions carry the absolute deviation and direction")
    void shouldDescribe() {
        assertThat(AnomalyClassifier.describe(AnomalyType.DURATION_SPIKE, 4.25, "m"))
                .isEqualTo("Test execution time 4.3σ above baseline");
        assertThat(AnomalyClassifier.describe(AnomalyType.FAILURE_SPIKE, -3, "m"))
                .isEqualTo("Failure rate 3.0σ below normal");
        assertThat(AnomalyClassifier.describe(AnomalyType.FLAKY_PATTERN, 1, "m"))
                .isEqualTo("Inconsistent test results detected");
    }
}
