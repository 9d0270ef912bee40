package com.qualitysentinel.core.baseline;

import com.qualitysentinel.core.model.Baseline;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted form of a baseline: the fitted values plus the config that
 * produced them.
 *
 * @since 1.0.0
 */
public final class BaselineRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final Baseline baseline;
    private final BaselineConfig config;
    private final Instant createdAt;
    private final Instant updatedAt;

    public BaselineRecord(String metricName, Baseline baseline, BaselineConfig config,
            Instant createdAt, Instant updatedAt) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    }

    public String getMetricName() {
        return metricName;
    }

    public Baseline getBaseline() {
        return baseline;
    }

    public BaselineConfig getConfig() {
        return config;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "BaselineRecord{metricName='" + metricName + "', baseline=" + baseline
                + ", config=" + config + ", updatedAt=" + updatedAt + '}';
    }
}
