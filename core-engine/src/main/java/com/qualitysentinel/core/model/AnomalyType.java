package com.qualitysentinel.core.model;

import java.util.Locale;

/**
 * Classification of a detected anomaly.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    /** Execution time spiked above baseline. */
    DURATION_SPIKE,
    /** Failure or error count rose above baseline. */
    FAILURE_SPIKE,
    /** Pass/fail results alternate without a code change. */
    FLAKY_PATTERN,
    /** A timing metric moved below its baseline. */
    PERFORMANCE_DEGRADATION,
    SUCCESS_RATE_DROP,
    PASS_RATE_DROP,
    RESOURCE_ANOMALY,
    TREND_CHANGE,
    SEASONAL_DEVIATION,
    CONSECUTIVE_FAILURES,
    FLAKY_DETECTED;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
