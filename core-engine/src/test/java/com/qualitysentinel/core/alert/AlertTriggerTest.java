package com.qualitysentinel.core.alert;

import com.qualitysentinel.core.model.AlertLevel;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyAlert;
import com.qualitysentinel.core.model.AnomalyStatus;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.HealthScore;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertTrigger}.
 */
class AlertTriggerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private MutableClock clock;
    private AlertTrigger trigger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        trigger = new AlertTrigger(AlertConfig.defaults(), clock);
    }

    // ------------------------------------------------------------------
    // Anomaly alerts
    // ------------------------------------------------------------------

    @Test
    @DisplayName("First alert for an anomaly is sent")
    void shouldNotifyFirstAlert() {
        AlertNotification n = trigger.triggerFromAnomaly(anomaly("anomaly-1000-1", Severity.HIGH));

        assertThat(n.shouldNotify()).isTrue();
        assertThat(n.getReason()).isEmpty();
        assertThat(n.getAlert().getTitle()).isEqualTo("Failure Spike Detected");
        assertThat(n.getAlert().getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(n.getAlert().getAnomalyId()).isEqualTo("anomaly-1000-1");
    }

    @Test
    @DisplayName("Severity below the configured minimum is suppressed")
    void shouldSuppressLowSeverity() {
        trigger.updateConfig(AlertConfig.defaults().toBuilder().minSeverity(Severity.MEDIUM).build());

        AlertNotification n = trigger.triggerFromAnomaly(anomaly("anomaly-1000-1", Severity.LOW));

        assertThat(n.shouldNotify()).isFalse();
        assertThat(n.getReason()).contains("Severity low below threshold medium");
    }

    @Test
    @DisplayName("Default policy lets low severity anomalies through")
    void shouldNotifyLowSeverityByDefault() {
        AlertNotification n = trigger.triggerFromAnomaly(anomaly("anomaly-1000-1", Severity.LOW));

        assertThat(n.shouldNotify()).isTrue();
        assertThat(AlertConfig.defaults().getMinSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("Disabled alerting suppresses everything")
    void shouldSuppressWhenDisabled() {
        trigger.updateConfig(AlertConfig.defaults().toBuilder().enabled(false).build());

        AlertNotification n = trigger.triggerFromAnomaly(anomaly("anomaly-1000-1", Severity.CRITICAL));

        assertThat(n.shouldNotify()).isFalse();
        assertThat(n.getReason()).contains("Alerts disabled");
    }

    @Test
    @DisplayName("Same title and id prefix within the window is a duplicate")
    void shouldDeduplicate() {
        assertThat(trigger.triggerFromAnomaly(anomaly("anomaly-1000-1", Severity.HIGH)).shouldNotify()).isTrue();

        AlertNotification second = trigger.triggerFromAnomaly(anomaly("anomaly-1000-2", Severity.HIGH));

        assertThat(second.shouldNotify()).isFalse();
        assertThat(second.getReason()).contains("Duplicate alert (Same alert within 300s)");
    }

    @Test
    @DisplayName("A different id prefix is not a duplicate")
    void shouldNotDeduplicateDifferentPrefix() {
        trigger.triggerFromAnomaly(anomaly("anomaly-1000-1", Severity.HIGH));

        assertThat(trigger.triggerFromAnomaly(anomaly("anomaly-2000-1", Severity.HIGH)).shouldNotify()).isTrue();
    }

    @Test
    @DisplayName("The same key alerts again once the window has passed")
    void shouldAlertAgainAfterWindow() {
        trigger.triggerFromAnomaly(anomaly("anomaly-1000-1", Severity.HIGH));
        clock.advance(Duration.ofMinutes(6));

        assertThat(trigger.triggerFromAnomaly(anomaly("anomaly-1000-2", Severity.HIGH)).shouldNotify()).isTrue();
    }

    @Test
    @DisplayName("Sixth alert of a title converges and the seventh hits the cooldown")
    void shouldConvergeThenCoolDown() {
        for (int i = 1; i <= 5; i++) {
            AlertNotification n = trigger.triggerFromAnomaly(anomaly("anomaly-" + i + "-1", Severity.HIGH));
            assertThat(n.shouldNotify()).as("alert %d", i).isTrue();
        }

        AlertNotification sixth = trigger.triggerFromAnomaly(anomaly("anomaly-6-1", Severity.HIGH));
        assertThat(sixth.shouldNotify()).isFalse();
        assertThat(sixth.getReason()).contains("Alert converged");
        assertThat(sixth.getConvergedCount()).hasValue(6);

        AlertNotification seventh = trigger.triggerFromAnomaly(anomaly("anomaly-7-1", Severity.HIGH));
        assertThat(seventh.shouldNotify()).isFalse();
        assertThat(seventh.getReason()).contains("In cooldown (1800000ms remaining)");

        assertThat(trigger.getConvergenceSummary()).hasSize(1);
        assertThat(trigger.getConvergenceSummary().get(0).getCount()).isEqualTo(6);
    }

    @Test
    @DisplayName("Alerts flow again once the cooldown is over")
    void shouldRecoverAfterCooldown() {
        for (int i = 1; i <= 6; i++) {
            trigger.triggerFromAnomaly(anomaly("anomaly-" + i + "-1", Severity.HIGH));
        }
        clock.advance(Duration.ofMinutes(31));

        assertThat(trigger.triggerFromAnomaly(anomaly("anomaly-8-1", Severity.HIGH)).shouldNotify()).isTrue();
    }

    // ------------------------------------------------------------------
    // Health score alerts
    // ------------------------------------------------------------------

    @Test
    @DisplayName("A small health drop raises nothing")
    void shouldIgnoreSmallHealthDrop() {
        assertThat(trigger.triggerFromHealthScore(health(83), health(85))).isEmpty();
        assertThat(trigger.triggerFromHealthScore(health(50), null)).isEmpty();
    }

    @Test
    @DisplayName("A drop of 20 points or more is critical")
    void shouldRaiseCriticalHealthAlert() {
        Optional<AlertNotification> n = trigger.triggerFromHealthScore(health(60), health(85));

        assertThat(n).isPresent();
        assertThat(n.get().shouldNotify()).isTrue();
        assertThat(n.get().getAlert().getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(n.get().getAlert().getTitle()).isEqualTo(AlertTrigger.HEALTH_ALERT_TITLE);
        assertThat(n.get().getAlert().getMessage())
                .isEqualTo("Overall health score dropped from 85.0 to 60.0 (25.0 point decrease).");
    }

    @Test
    @DisplayName("A drop between 10 and 20 points is a warning and repeats are deduplicated")
    void shouldRaiseWarningOnce() {
        Optional<AlertNotification> first = trigger.triggerFromHealthScore(health(72), health(85));
        Optional<AlertNotification> second = trigger.triggerFromHealthScore(health(60), health(72));

        assertThat(first).map(n -> n.getAlert().getLevel()).contains(AlertLevel.WARNING);
        assertThat(second).isPresent();
        assertThat(second.get().shouldNotify()).isFalse();
        assertThat(second.get().getReason()).contains("Duplicate");
    }

    // ------------------------------------------------------------------
    // Tracking
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Acknowledging is idempotent and unknown ids are reported")
    void shouldAcknowledgeIdempotently() {
        AnomalyAlert alert = trigger.triggerFromAnomaly(anomaly("anomaly-1000-1", Severity.HIGH)).getAlert();

        assertThat(trigger.acknowledgeAlert(alert.getId())).isTrue();
        clock.advance(Duration.ofSeconds(10));
        assertThat(trigger.acknowledgeAlert(alert.getId())).isTrue();

        assertThat(alert.getAcknowledgedAt()).isEqualTo(NOW);
        assertThat(trigger.getPendingAlerts()).isEmpty();
        assertThat(trigger.acknowledgeAlert("alert-missing")).isFalse();
    }

    @Test
    @DisplayName("Acknowledge-all counts only newly acknowledged alerts")
    void shouldAcknowledgeAll() {
        String first = trigger.triggerFromAnomaly(anomaly("anomaly-1-1", Severity.HIGH)).getAlert().getId();
        trigger.triggerFromAnomaly(anomaly("anomaly-2-1", Severity.HIGH));
        trigger.acknowledgeAlert(first);

        assertThat(trigger.acknowledgeAll()).isEqualTo(1);
        assertThat(trigger.acknowledgeAll()).isZero();
    }

    @Test
    @DisplayName("Stats group tracked alerts by level and title")
    void shouldReportStats() {
        trigger.triggerFromAnomaly(anomaly("anomaly-1-1", Severity.HIGH));
        trigger.triggerFromAnomaly(anomaly("anomaly-2-1", Severity.CRITICAL));

        AlertStats stats = trigger.getStats();

        assertThat(stats.getTotal()).isEqualTo(2);
        assertThat(stats.getPending()).isEqualTo(2);
        assertThat(stats.getByLevel().get(AlertLevel.CRITICAL)).isEqualTo(1);
        assertThat(stats.getByLevel().get(AlertLevel.EMERGENCY)).isEqualTo(1);
        assertThat(stats.getByType()).containsEntry("Failure", 2);
        assertThat(stats.getRecentConverged()).isEqualTo(1);
    }

    @Test
    @DisplayName("Cleanup drops alerts older than twice the dedup window")
    void shouldCleanUp() {
        trigger.triggerFromAnomaly(anomaly("anomaly-1-1", Severity.HIGH));
        clock.advance(Duration.ofMinutes(11));

        trigger.cleanup();

        assertThat(trigger.getPendingAlerts()).isEmpty();
        assertThat(trigger.getStats().getTotal()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Anomaly anomaly(String id, Severity severity) {
        return Anomaly.builder()
                .id(id)
                .type(AnomalyType.FAILURE_SPIKE)
                .severity(severity)
                .status(AnomalyStatus.NEW)
                .detectedAt(clock.instant())
                .metricName("suite:failures")
                .currentValue(12)
                .expectedValue(3)
                .deviation(4.5)
                .build();
    }

    private HealthScore health(double overall) {
        return new HealthScore(overall, clock.instant());
    }
}
