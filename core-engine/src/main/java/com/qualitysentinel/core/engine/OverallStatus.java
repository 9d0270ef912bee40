package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.Severity;

import java.util.Collection;
import java.util.Locale;

/**
 * Roll-up status of a set of anomalies.
 *
 * @since 1.0.0
 */
public enum OverallStatus {

    NORMAL,
    WARNING,
    CRITICAL;

    /**
     * {@code CRITICAL} if any anomaly is high or critical, {@code WARNING} if
     * there is any anomaly, else {@code NORMAL}.
     */
    public static OverallStatus of(Collection<Anomaly> anomalies) {
        if (anomalies.stream().anyMatch(a -> a.getSeverity().isAtLeast(Severity.HIGH))) {
            return CRITICAL;
        }
        return anomalies.isEmpty() ? NORMAL : WARNING;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
