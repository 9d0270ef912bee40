package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.model.Baseline;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a detector may look at besides the candidate value.
 *
 * <p>
 * The baseline, when present, already has any seasonal factor for the
 * sample's timestamp applied. {@code threshold} is the sensitivity-derived
 * z-score limit.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final String metricName;
    private final Baseline baseline;
    private final double[] history;
    private final double threshold;

    public DetectionContext(String metricName, Baseline baseline, double[] history, double threshold) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.baseline = baseline;
        this.history = history == null ? new double[0] : Arrays.copyOf(history, history.length);
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public String getMetricName() {
        return metricName;
    }

    public Optional<Baseline> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    /** @return copy of the historical values, oldest first */
    public double[] getHistory() {
        return Arrays.copyOf(history, history.length);
    }

    public int getHistorySize() {
        return history.length;
    }

    public double getThreshold() {
        return threshold;
    }
}
