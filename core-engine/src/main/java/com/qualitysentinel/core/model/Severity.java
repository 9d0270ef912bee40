package com.qualitysentinel.core.model;

import java.util.Locale;

/**
 * Severity class of an anomaly, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    /** Weight used when prioritising anomalies against each other. */
    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * @param other severity to compare against
     * @return {@code true} if this severity ranks the same as or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Lowercase identifier used in configuration files and messages.
     *
     * @return identifier, e.g. {@code "high"}
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a configuration identifier, ignoring case.
     *
     * @param id identifier such as {@code "medium"}
     * @return matching severity
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static Severity fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Severity must not be null or blank");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown severity: '" + id + "'. Supported: low, medium, high, critical", e);
        }
    }
}
