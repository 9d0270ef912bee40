package com.qualitysentinel.core.alert;

import java.time.Instant;
import java.util.Objects;

/**
 * Rolling count of same-titled alerts. Immutable; each new alert produces a
 * new group.
 *
 * @since 1.0.0
 */
public final class ConvergenceGroup {

    private final String key;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final int count;
    private final String lastAlertId;

    private ConvergenceGroup(String key, Instant firstSeen, Instant lastSeen, int count, String lastAlertId) {
        this.key = key;
        this.firstSeen = firstSeen;
        this.lastSeen = lastSeen;
        this.count = count;
        this.lastAlertId = lastAlertId;
    }

    static ConvergenceGroup start(String key, String alertId, Instant at) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(at, "at must not be null");
        return new ConvergenceGroup(key, at, at, 1, alertId);
    }

    ConvergenceGroup record(String alertId, Instant at) {
        return new ConvergenceGroup(key, firstSeen, at, count + 1, alertId);
    }

    public String getKey() {
        return key;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public int getCount() {
        return count;
    }

    public String getLastAlertId() {
        return lastAlertId;
    }

    @Override
    public String toString() {
        return "ConvergenceGroup{key='" + key + "', count=" + count + ", lastSeen=" + lastSeen + '}';
    }
}
