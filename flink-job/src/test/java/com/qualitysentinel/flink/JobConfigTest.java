package com.qualitysentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults are usable as-is")
    void shouldBuildWithDefaults() {
        JobConfig config = JobConfig.builder().build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("quality-metrics");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("quality-alerts");
        assertThat(config.getHistorySize()).isEqualTo(100);
        assertThat(config.getBaselineRebuildInterval()).isEqualTo(20);
        assertThat(config.getSentinelConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a blank alert topic")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> JobConfig.builder().kafkaAlertTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaAlertTopic");
    }

    @Test
    @DisplayName("Should reject a history smaller than the rebuild interval")
    void shouldRejectHistorySmallerThanRebuildInterval() {
        assertThatThrownBy(() -> JobConfig.builder().historySize(10).baselineRebuildInterval(20).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("historySize");
    }

    @Test
    @DisplayName("Should reject non-positive parallelism")
    void shouldRejectZeroParallelism() {
        assertThatThrownBy(() -> JobConfig.builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }
}
