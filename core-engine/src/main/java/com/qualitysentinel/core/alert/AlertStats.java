package com.qualitysentinel.core.alert;

import com.qualitysentinel.core.model.AlertLevel;

import java.util.Collections;
import java.util.Map;

/**
 * Counts over the alerts the trigger currently tracks.
 *
 * @since 1.0.0
 */
public final class AlertStats {

    private final int total;
    private final Map<AlertLevel, Integer> byLevel;
    private final Map<String, Integer> byType;
    private final int acknowledged;
    private final int pending;
    private final int recentConverged;

    AlertStats(int total, Map<AlertLevel, Integer> byLevel, Map<String, Integer> byType, int acknowledged,
            int pending, int recentConverged) {
        this.total = total;
        this.byLevel = Collections.unmodifiableMap(byLevel);
        this.byType = Collections.unmodifiableMap(byType);
        this.acknowledged = acknowledged;
        this.pending = pending;
        this.recentConverged = recentConverged;
    }

    public int getTotal() {
        return total;
    }

    public Map<AlertLevel, Integer> getByLevel() {
        return byLevel;
    }

    /** Keyed by the first word of the alert title. */
    public Map<String, Integer> getByType() {
        return byType;
    }

    public int getAcknowledged() {
        return acknowledged;
    }

    public int getPending() {
        return pending;
    }

    /** Alerts folded into a live convergence group beyond its first. */
    public int getRecentConverged() {
        return recentConverged;
    }

    @Override
    public String toString() {
        return "AlertStats{total=" + total + ", pending=" + pending + ", acknowledged=" + acknowledged
                + ", recentConverged=" + recentConverged + '}';
    }
}
