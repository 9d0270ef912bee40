package com.qualitysentinel.core.algorithms;

import java.util.Locale;

/**
 * Shape of the most recent run of execution results.
 *
 * @since 1.0.0
 */
public enum StreakPattern {
    CONSECUTIVE_FAILURES,
    INTERMITTENT,
    STABLE,
    RECOVERING;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
