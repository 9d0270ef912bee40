package com.qualitysentinel.core.storage;

import com.qualitysentinel.core.model.AlertLevel;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyAlert;
import com.qualitysentinel.core.model.AnomalyStatus;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.HealthScore;
import com.qualitysentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryAnomalyStore}.
 */
class InMemoryAnomalyStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final InMemoryAnomalyStore store = new InMemoryAnomalyStore(2);

    @Test
    @DisplayName("Queries return newest anomalies first")
    void shouldOrderNewestFirst() {
        store.saveAnomaly(anomaly("a1", "m1", T0));
        store.saveAnomaly(anomaly("a2", "m2", T0.plusSeconds(60)));
        store.saveAnomaly(anomaly("a3", "m1", T0.plusSeconds(120)));

        assertThat(store.getAllAnomalies()).extracting(Anomaly::getId).containsExactly("a3", "a2", "a1");
        assertThat(store.getAnomaliesByMetric("m1")).extracting(Anomaly::getId).containsExactly("a3", "a1");
        assertThat(store.getRecentAnomalies(2)).extracting(Anomaly::getId).containsExactly("a3", "a2");
        assertThat(store.getAnomaliesBetween(T0, T0.plusSeconds(60)))
                .extracting(Anomaly::getId).containsExactly("a2", "a1");
    }

    @Test
    @DisplayName("Only resolved anomalies older than the cutoff are deleted")
    void shouldDeleteResolvedBeforeCutoff() {
        Anomaly old = anomaly("a1", "m", T0);
        old.resolve(T0.plusSeconds(10));
        Anomaly active = anomaly("a2", "m", T0);
        Anomaly recent = anomaly("a3", "m", T0.plusSeconds(600));
        recent.resolve(T0.plusSeconds(700));
        store.saveAnomaly(old);
        store.saveAnomaly(active);
        store.saveAnomaly(recent);

        assertThat(store.deleteResolvedBefore(T0.plusSeconds(300))).isEqualTo(1);
        assertThat(store.getAllAnomalies()).extracting(Anomaly::getId).containsExactlyInAnyOrder("a2", "a3");
        assertThat(store.getActiveAnomalies()).extracting(Anomaly::getId).containsExactly("a2");
    }

    @Test
    @DisplayName("An old anomaly resolved recently survives the cutoff")
    void shouldJudgeRetentionByResolutionTime() {
        Anomaly lingering = anomaly("a1", "m", T0);
        lingering.resolve(T0.plusSeconds(500));
        store.saveAnomaly(lingering);

        assertThat(store.deleteResolvedBefore(T0.plusSeconds(300))).isZero();
        assertThat(store.deleteResolvedBefore(T0.plusSeconds(600))).isEqualTo(1);
    }

    @Test
    @DisplayName("A full anomaly store evicts resolved entries before active ones")
    void shouldCapAnomalies() {
        InMemoryAnomalyStore small = new InMemoryAnomalyStore(2, 2, 2);
        Anomaly resolved = anomaly("a2", "m", T0.plusSeconds(60));
        resolved.resolve(T0.plusSeconds(90));
        small.saveAnomaly(anomaly("a1", "m", T0));
        small.saveAnomaly(resolved);
        small.saveAnomaly(anomaly("a3", "m", T0.plusSeconds(120)));

        assertThat(small.getAllAnomalies()).extracting(Anomaly::getId).containsExactly("a3", "a1");

        small.saveAnomaly(anomaly("a4", "m", T0.plusSeconds(180)));
        assertThat(small.getAllAnomalies()).extracting(Anomaly::getId).containsExactly("a4", "a3");
    }

    @Test
    @DisplayName("Alerts are capped and can be purged by age")
    void shouldCapAndPurgeAlerts() {
        InMemoryAnomalyStore small = new InMemoryAnomalyStore(2, 2, 2);
        small.saveAlert(alert("alert-1", T0));
        small.saveAlert(alert("alert-2", T0.plusSeconds(60)));
        small.saveAlert(alert("alert-3", T0.plusSeconds(120)));

        assertThat(small.getRecentAlerts(10)).extracting(AnomalyAlert::getId).containsExactly("alert-3", "alert-2");
        assertThat(small.deleteAlertsBefore(T0.plusSeconds(90))).isEqualTo(1);
        assertThat(small.getRecentAlerts(10)).extracting(AnomalyAlert::getId).containsExactly("alert-3");
    }

    @Test
    @DisplayName("Health score history keeps the newest entries up to capacity")
    void shouldCapHealthScores() {
        store.saveHealthScore(new HealthScore(80, T0));
        store.saveHealthScore(new HealthScore(82, T0.plusSeconds(60)));
        store.saveHealthScore(new HealthScore(70, T0.plusSeconds(120)));

        assertThat(store.getLatestHealthScore()).map(HealthScore::getOverall).contains(70.0);
        assertThat(store.getRecentHealthScores(5)).extracting(HealthScore::getOverall).containsExactly(70.0, 82.0);
    }

    private static AnomalyAlert alert(String id, Instant createdAt) {
        return AnomalyAlert.builder()
                .id(id)
                .anomalyId("a-" + id)
                .level(AlertLevel.WARNING)
                .title("Duration Spike Detected")
                .message("checkout:duration above expected range")
                .createdAt(createdAt)
                .build();
    }

    private static Anomaly anomaly(String id, String metric, Instant detectedAt) {
        return Anomaly.builder()
                .id(id)
                .type(AnomalyType.DURATION_SPIKE)
                .severity(Severity.MEDIUM)
                .status(AnomalyStatus.NEW)
                .detectedAt(detectedAt)
                .metricName(metric)
                .build();
    }
}
