package com.qualitysentinel.core.alert;

import com.qualitysentinel.core.model.AlertLevel;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyStatus;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.RootCause;
import com.qualitysentinel.core.model.RootCauseCategory;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.model.Suggestion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertTemplate} and {@link AlertTemplates}.
 */
class AlertTemplateTest {

    @Test
    @DisplayName("Every anomaly type has a template")
    void shouldCoverEveryType() {
        assertThat(AlertTemplates.all()).containsOnlyKeys(AnomalyType.values());
    }

    @Test
    @DisplayName("Placeholders are filled and whole numbers print without decimals")
    void shouldFillPlaceholders() {
        Anomaly anomaly = anomaly(AnomalyType.DURATION_SPIKE, 1500, 1000, List.of());

        String message = AlertTemplates.forType(AnomalyType.DURATION_SPIKE).render(anomaly);

        assertThat(message).isEqualTo("Execution time spiked to 1500ms (baseline: 1000ms). 50.0% above normal.");
    }

    @Test
    @DisplayName("Root causes and unique suggestions are appended")
    void shouldAppendRootCauses() {
        Suggestion retry = new Suggestion("Add an explicit wait", 1, Suggestion.Effort.LOW);
        List<RootCause> causes = List.of(
                new RootCause("rc-1", RootCauseCategory.TIMING_ISSUE, "Slow page load", 80, List.of(retry)),
                new RootCause("rc-2", RootCauseCategory.NETWORK_ISSUE, "API latency", 45.4, List.of(retry)));

        String message = AlertTemplates.forType(AnomalyType.DURATION_SPIKE)
                .render(anomaly(AnomalyType.DURATION_SPIKE, 1500, 1000, causes));

        assertThat(message).contains("\n\nRoot Causes:\n"
                + "1. [timing_issue] Slow page load (80% confidence)\n"
                + "2. [network_issue] API latency (45% confidence)");
        assertThat(message).endsWith("\n\nSuggested Actions:\n1. Add an explicit wait");
    }

    @Test
    @DisplayName("Case name falls back to the case id, then to Unknown")
    void shouldFallBackForCaseName() {
        AlertTemplate flaky = AlertTemplates.forType(AnomalyType.FLAKY_PATTERN);
        Anomaly withId = Anomaly.builder()
                .id("anomaly-1-1")
                .type(AnomalyType.FLAKY_PATTERN)
                .severity(Severity.MEDIUM)
                .status(AnomalyStatus.NEW)
                .detectedAt(Instant.EPOCH)
                .metricName("tc-9:flaky")
                .caseId("tc-9")
                .description("Flaky score 0.80")
                .build();

        assertThat(flaky.render(withId)).isEqualTo("Test \"tc-9\" shows flaky behavior. Flaky score 0.80.");
        assertThat(flaky.render(anomaly(AnomalyType.FLAKY_PATTERN, 1, 1, List.of()))).contains("\"Unknown\"");
    }

    @Test
    @DisplayName("Flaky alerts map high severity to a warning")
    void shouldUseFlakyLevels() {
        assertThat(AlertTemplates.forType(AnomalyType.FLAKY_PATTERN).levelFor(Severity.HIGH))
                .isEqualTo(AlertLevel.WARNING);
        assertThat(AlertTemplates.forType(AnomalyType.FAILURE_SPIKE).levelFor(Severity.HIGH))
                .isEqualTo(AlertLevel.CRITICAL);
        assertThat(AlertTemplates.forType(AnomalyType.FAILURE_SPIKE).levelFor(Severity.CRITICAL))
                .isEqualTo(AlertLevel.EMERGENCY);
    }

    private static Anomaly anomaly(AnomalyType type, double value, double expected, List<RootCause> causes) {
        return Anomaly.builder()
                .id("anomaly-1-1")
                .type(type)
                .severity(Severity.HIGH)
                .status(AnomalyStatus.NEW)
                .detectedAt(Instant.EPOCH)
                .metricName("checkout:duration")
                .currentValue(value)
                .expectedValue(expected)
                .rootCauses(causes)
                .build();
    }
}
