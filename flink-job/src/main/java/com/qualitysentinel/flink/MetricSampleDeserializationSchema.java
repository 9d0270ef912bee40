package com.qualitysentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qualitysentinel.core.model.MetricSample;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes to a
 * {@link MetricSample}.
 * <p>
 * Malformed messages, including samples with a missing name or a non-finite
 * value, are logged and dropped (returns {@code null}) so a single bad record
 * cannot fail the job.
 * </p>
 */
public class MetricSampleDeserializationSchema implements DeserializationSchema<MetricSample> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricSampleDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public MetricSample deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, MetricSample.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize metric sample, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(MetricSample nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<MetricSample> getProducedType() {
        return TypeInformation.of(MetricSample.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        }
        return mapper;
    }
}
