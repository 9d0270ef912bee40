package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * One observation of a named metric, as read from the metrics topic.
 *
 * <p>
 * Unknown JSON properties are ignored so producers can add fields without
 * breaking consumers.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final double value;
    private final long timestamp;
    private final String caseId;

    @JsonCreator
    public MetricSample(@JsonProperty("metricName") String metricName,
            @JsonProperty("value") double value,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("caseId") String caseId) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite, got: " + value);
        }
        this.value = value;
        this.timestamp = timestamp;
        this.caseId = caseId;
    }

    public static MetricSample of(String metricName, double value, long timestamp) {
        return new MetricSample(metricName, value, timestamp, null);
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    /** @return epoch milliseconds */
    public long getTimestamp() {
        return timestamp;
    }

    public Optional<String> getCaseId() {
        return Optional.ofNullable(caseId);
    }

    public DataPoint toDataPoint() {
        return DataPoint.of(timestamp, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp == that.timestamp
                && metricName.equals(that.metricName)
                && Objects.equals(caseId, that.caseId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, value, timestamp, caseId);
    }

    @Override
    public String toString() {
        return "MetricSample{" +
                "metricName='" + metricName + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                (caseId != null ? ", caseId='" + caseId + '\'' : "") +
                '}';
    }
}
