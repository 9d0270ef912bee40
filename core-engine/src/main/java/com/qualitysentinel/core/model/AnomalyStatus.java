package com.qualitysentinel.core.model;

import java.util.Locale;

/**
 * Lifecycle state of an {@link Anomaly}. {@link #RESOLVED} is terminal.
 *
 * @since 1.0.0
 */
public enum AnomalyStatus {

    NEW,
    ACKNOWLEDGED,
    INVESTIGATING,
    RESOLVED;

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
