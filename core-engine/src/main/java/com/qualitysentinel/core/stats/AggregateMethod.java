package com.qualitysentinel.core.stats;

/**
 * Reduction applied to the values falling into one aggregation bucket.
 *
 * @since 1.0.0
 */
public enum AggregateMethod {
    MEAN, SUM, MAX, MIN, LAST
}
