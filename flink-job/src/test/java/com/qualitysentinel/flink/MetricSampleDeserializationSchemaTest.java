package com.qualitysentinel.flink;

import com.qualitysentinel.core.model.MetricSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricSampleDeserializationSchema}.
 */
class MetricSampleDeserializationSchemaTest {

    private final MetricSampleDeserializationSchema schema = new MetricSampleDeserializationSchema();

    @Test
    @DisplayName("Should parse a sample and ignore unknown fields")
    void shouldParseSample() throws Exception {
        String json = "{\"metricName\":\"suite:pass_rate\",\"value\":0.92,\"timestamp\":1700000000000,"
                + "\"caseId\":\"tc-7\",\"runner\":\"ci-3\"}";

        MetricSample sample = schema.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(sample).isNotNull();
        assertThat(sample.getMetricName()).isEqualTo("suite:pass_rate");
        assertThat(sample.getValue()).isEqualTo(0.92);
        assertThat(sample.getTimestamp()).isEqualTo(1_700_000_000_000L);
        assertThat(sample.getCaseId()).contains("tc-7");
    }

    @Test
    @DisplayName("Should drop malformed JSON instead of failing")
    void shouldDropMalformed() throws Exception {
        assertThat(schema.deserialize("{not json".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
    }

    @Test
    @DisplayName("Should drop a sample without a metric name")
    void shouldDropMissingName() throws Exception {
        String json = "{\"value\":1.0,\"timestamp\":1}";

        assertThat(schema.deserialize(json.getBytes(StandardCharsets.UTF_8))).isNull();
    }
}
