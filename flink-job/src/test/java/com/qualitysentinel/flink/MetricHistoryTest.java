package com.qualitysentinel.flink;

import com.qualitysentinel.core.model.DataPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricHistory}.
 */
class MetricHistoryTest {

    @Test
    @DisplayName("Should evict the oldest value once full")
    void shouldEvictOldest() {
        MetricHistory history = new MetricHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.append(DataPoint.of(i * 1000L, i));
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.values()).containsExactly(3.0, 4.0, 5.0);
        assertThat(history.points()).extracting(DataPoint::getTimestamp).containsExactly(3000L, 4000L, 5000L);
    }

    @Test
    @DisplayName("Rebuild becomes due after the interval and resets when marked")
    void shouldTrackRebuildInterval() {
        MetricHistory history = new MetricHistory(10);
        history.append(DataPoint.of(1L, 1.0));
        history.append(DataPoint.of(2L, 2.0));
        assertThat(history.isRebuildDue(3)).isFalse();

        history.append(DataPoint.of(3L, 3.0));
        assertThat(history.isRebuildDue(3)).isTrue();

        history.markRebuilt();
        assertThat(history.getSamplesSinceRebuild()).isZero();
        assertThat(history.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should drop points older than the cutoff")
    void shouldEvictBeforeCutoff() {
        MetricHistory history = new MetricHistory(10);
        for (int i = 1; i <= 5; i++) {
            history.append(DataPoint.of(i * 1000L, i));
        }

        assertThat(history.evictBefore(3000L)).isEqualTo(2);
        assertThat(history.values()).containsExactly(3.0, 4.0, 5.0);
        assertThat(history.evictBefore(0L)).isZero();
    }

    @Test
    @DisplayName("Should reject zero capacity")
    void shouldRejectZeroCapacity() {
        assertThatThrownBy(() -> new MetricHistory(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
