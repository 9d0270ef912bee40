package com.qualitysentinel.core.model;

import java.util.Locale;

/**
 * Urgency level carried by an {@link AnomalyAlert}.
 *
 * @since 1.0.0
 */
public enum AlertLevel {

    INFO,
    WARNING,
    CRITICAL,
    EMERGENCY;

    /**
     * Default mapping from anomaly severity to alert level.
     *
     * @param severity anomaly severity; must not be {@code null}
     * @return corresponding alert level
     */
    public static AlertLevel fromSeverity(Severity severity) {
        return switch (severity) {
            case LOW -> INFO;
            case MEDIUM -> WARNING;
            case HIGH -> CRITICAL;
            case CRITICAL -> EMERGENCY;
        };
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
