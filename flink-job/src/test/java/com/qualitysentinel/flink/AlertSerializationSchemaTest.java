package com.qualitysentinel.flink;

import com.qualitysentinel.core.model.AlertLevel;
import com.qualitysentinel.core.model.AnomalyAlert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertSerializationSchema}.
 */
class AlertSerializationSchemaTest {

    @Test
    @DisplayName("Should write ISO timestamps and omit unset acknowledgement time")
    void shouldSerializeAlert() {
        AnomalyAlert alert = AnomalyAlert.builder()
                .id("alert-1-1")
                .anomalyId("anomaly-1-1")
                .level(AlertLevel.WARNING)
                .title("Pass Rate Dropped")
                .message("Pass rate fell to 70")
                .createdAt(Instant.parse("2024-03-01T10:15:30Z"))
                .build();

        String json = new String(new AlertSerializationSchema().serialize(alert), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"id\":\"alert-1-1\"")
                .contains("\"level\":\"WARNING\"")
                .contains("\"createdAt\":\"2024-03-01T10:15:30Z\"")
                .contains("\"acknowledged\":false")
                .doesNotContain("acknowledgedAt");
    }
}
