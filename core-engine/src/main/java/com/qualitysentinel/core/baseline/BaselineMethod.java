package com.qualitysentinel.core.baseline;

import java.util.Locale;

/**
 * Estimator used to fit a {@link com.qualitysentinel.core.model.Baseline}.
 *
 * @since 1.0.0
 */
public enum BaselineMethod {

    /** Mean and population stdDev of the most recent {@code windowSize} points. */
    MOVING_AVERAGE,
    /** Exponentially weighted level and variance, alpha 0.3. */
    EXPONENTIAL_SMOOTHING,
    /** Median centre, IQR / 1.35 spread, 5th/95th percentile as min/max. */
    PERCENTILE,
    /** Median centre, MAD × 1.4826 spread. */
    MEDIAN;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param id identifier such as {@code "exponential_smoothing"}, case-insensitive
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static BaselineMethod fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Baseline method must not be null or blank");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown baseline method: '" + id
                    + "'. Supported: moving_average, exponential_smoothing, percentile, median", e);
        }
    }
}
