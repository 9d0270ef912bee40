package com.qualitysentinel.flink;

import com.qualitysentinel.core.baseline.BaselineRecord;
import com.qualitysentinel.core.config.SentinelConfig;
import com.qualitysentinel.core.engine.DetectionResult;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.pipeline.AnomalyPipeline;
import com.qualitysentinel.core.pipeline.PipelineOutcome;
import com.qualitysentinel.core.storage.InMemoryAnomalyStore;
import com.qualitysentinel.core.storage.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the per-sample step of {@link MetricAnomalyProcessFunction}.
 */
class MetricAnomalyProcessFunctionTest {

    private static final String METRIC = "checkout-suite:duration";
    private static final long START = Instant.parse("2024-03-01T00:00:00Z").toEpochMilli();
    private static final Instant NOW = Instant.parse("2024-03-02T00:00:00Z");

    private SentinelConfig config;
    private FlakyStore store;
    private AnomalyPipeline pipeline;
    private MetricHistory history;

    @BeforeEach
    void setUp() {
        config = new SentinelConfig();
        config.validate();
        store = new FlakyStore();
        pipeline = AnomalyPipeline.create(config, store, Clock.fixed(NOW, ZoneOffset.UTC));
        history = new MetricHistory(50);
    }

    @Test
    @DisplayName("Should report insufficient data while the history is short")
    void shouldWaitForHistory() {
        PipelineOutcome outcome = MetricAnomalyProcessFunction.advance(
                pipeline, history, sample(0, 100), 20, null);

        assertThat(outcome.getDetection().getStatus()).isEqualTo(DetectionResult.Status.INSUFFICIENT_DATA);
        assertThat(history.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refit the baseline after the rebuild interval")
    void shouldRebuildBaseline() {
        for (int i = 0; i < 20; i++) {
            MetricAnomalyProcessFunction.advance(pipeline, history, sample(i, i % 2 == 0 ? 99 : 101), 20, null);
        }

        assertThat(store.getBaseline(METRIC)).isPresent();
        assertThat(history.getSamplesSinceRebuild()).isZero();
    }

    @Test
    @DisplayName("Should flag an outlier once the history is established")
    void shouldDetectOutlier() {
        for (int i = 0; i < 20; i++) {
            MetricAnomalyProcessFunction.advance(pipeline, history, sample(i, i % 2 == 0 ? 99 : 101), 20, null);
        }

        PipelineOutcome outcome = MetricAnomalyProcessFunction.advance(
                pipeline, history, sample(20, 500), 20, null);

        assertThat(outcome.getDetection().isAnomaly()).isTrue();
        assertThat(store.getAnomaliesByMetric(METRIC)).hasSize(1);
        assertThat(history.size()).isEqualTo(21);
    }

    @Test
    @DisplayName("Should still return the surfaced alert when the baseline refit fails")
    void shouldKeepAlertWhenRefitFails() {
        warmUp();
        store.failBaselineWrites = true;

        PipelineOutcome outcome = MetricAnomalyProcessFunction.advance(
                pipeline, history, sample(20, 500), 1, null);

        assertThat(outcome.getSurfacedAlert()).isPresent();
        assertThat(store.getRecentAlerts(10)).containsExactly(outcome.getSurfacedAlert().get());
        assertThat(history.size()).isEqualTo(21);
        assertThat(history.getSamplesSinceRebuild()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should leave the history untouched when detection cannot read the store")
    void shouldSkipSampleWhenDetectionFails() {
        warmUp();
        store.failBaselineReads = true;

        assertThatThrownBy(() -> MetricAnomalyProcessFunction.advance(
                pipeline, history, sample(20, 500), 20, null))
                .isInstanceOf(PersistenceException.class);
        assertThat(history.size()).isEqualTo(20);
        assertThat(store.getAllAnomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should refit a baseline older than the configured maximum age")
    void shouldRefitStaleBaseline() {
        warmUp();
        Instant later = NOW.plus(config.getBaseline().getMaxAge()).plus(Duration.ofHours(1));
        AnomalyPipeline laterPipeline = AnomalyPipeline.create(config, store, Clock.fixed(later, ZoneOffset.UTC));

        MetricAnomalyProcessFunction.advance(laterPipeline, history, sample(20, 100), 100, null);

        assertThat(store.getBaseline(METRIC).map(BaselineRecord::getUpdatedAt)).contains(later);
        assertThat(history.getSamplesSinceRebuild()).isZero();
    }

    @Test
    @DisplayName("Should drop history older than the detection window")
    void shouldEvictHistoryOutsideWindow() {
        warmUp();
        long farLater = START + Duration.ofDays(config.getDetection().getDetectionWindowDays() + 1).toMillis();

        MetricAnomalyProcessFunction.advance(pipeline, history, MetricSample.of(METRIC, 100, farLater), 100, null);

        assertThat(history.size()).isEqualTo(1);
    }

    // ---- Helpers ----

    private void warmUp() {
        for (int i = 0; i < 20; i++) {
            MetricAnomalyProcessFunction.advance(pipeline, history, sample(i, i % 2 == 0 ? 99 : 101), 20, null);
        }
    }

    private static final class FlakyStore extends InMemoryAnomalyStore {

        private boolean failBaselineWrites;
        private boolean failBaselineReads;

        @Override
        public Optional<BaselineRecord> getBaseline(String metricName) {
            if (failBaselineReads) {
                throw new PersistenceException("baseline read failed");
            }
            return super.getBaseline(metricName);
        }

        @Override
        public void saveBaseline(BaselineRecord record) {
            if (failBaselineWrites) {
                throw new PersistenceException("baseline write failed");
            }
            super.saveBaseline(record);
        }
    }

    private static MetricSample sample(int index, double value) {
        return MetricSample.of(METRIC, value, START + index * 60_000L);
    }
}
