package com.qualitysentinel.core.engine;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A single value to check, plus optional context.
 *
 * <p>
 * {@code history} is consulted when no baseline is stored for the metric and
 * by the window-based detectors. When {@code timestamp} is unset the engine
 * uses its clock. When {@code config} is unset the engine's default config
 * applies.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionRequest {

    private final String metricName;
    private final double value;
    private final Instant timestamp;
    private final String caseId;
    private final String caseName;
    private final double[] history;
    private final DetectionConfig config;

    private DetectionRequest(Builder b) {
        this.metricName = b.metricName;
        this.value = b.value;
        this.timestamp = b.timestamp;
        this.caseId = b.caseId;
        this.caseName = b.caseName;
        this.history = b.history;
        this.config = b.config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DetectionRequest of(String metricName, double value) {
        return builder().metricName(metricName).value(value).build();
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<String> getCaseId() {
        return Optional.ofNullable(caseId);
    }

    public Optional<String> getCaseName() {
        return Optional.ofNullable(caseName);
    }

    /** @return copy of the historical values, oldest first; empty if none */
    public double[] getHistory() {
        return Arrays.copyOf(history, history.length);
    }

    public Optional<DetectionConfig> getConfig() {
        return Optional.ofNullable(config);
    }

    @Override
    public String toString() {
        return "DetectionRequest{metric='" + metricName + "', value=" + value
                + ", history=" + history.length + '}';
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static class Builder {

        private String metricName;
        private double value;
        private Instant timestamp;
        private String caseId;
        private String caseName;
        private double[] history = new double[0];
        private DetectionConfig config;

        private Builder() {
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder caseId(String caseId) {
            this.caseId = caseId;
            return this;
        }

        public Builder caseName(String caseName) {
            this.caseName = caseName;
            return this;
        }

        public Builder history(double[] history) {
            this.history = history == null ? new double[0] : Arrays.copyOf(history, history.length);
            return this;
        }

        public Builder config(DetectionConfig config) {
            this.config = config;
            return this;
        }

        public DetectionRequest build() {
            Objects.requireNonNull(metricName, "metricName must not be null");
            if (metricName.isBlank()) {
                throw new IllegalArgumentException("metricName must not be blank");
            }
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("value must be finite, got: " + value);
            }
            return new DetectionRequest(this);
        }
    }
}
