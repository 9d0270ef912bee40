package com.qualitysentinel.core.engine;

import java.util.Locale;

/**
 * Detection sensitivity, mapped to a z-score threshold.
 *
 * @since 1.0.0
 */
public enum Sensitivity {

    /** Flags only major deviations. */
    LOW(4.0),
    MEDIUM(3.0),
    /** Flags smaller deviations. */
    HIGH(2.0);

    private final double threshold;

    Sensitivity(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Sensitivity fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Sensitivity must not be null or blank");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown sensitivity: '" + id + "'. Supported: low, medium, high", e);
        }
    }
}
