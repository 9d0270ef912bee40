package com.qualitysentinel.core.baseline;

/**
 * No valid points remained to fit a baseline from.
 *
 * <p>
 * A caller mistake rather than a transient condition; retrying with the same
 * input fails the same way.
 * </p>
 *
 * @since 1.0.0
 */
public class EmptyBaselineInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String metricName;

    public EmptyBaselineInputException(String metricName) {
        super("No valid data points for baseline: " + metricName);
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
