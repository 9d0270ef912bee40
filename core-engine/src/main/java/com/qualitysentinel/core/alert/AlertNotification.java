package com.qualitysentinel.core.alert;

import com.qualitysentinel.core.model.AnomalyAlert;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * An alert plus the decision whether to surface it.
 *
 * @since 1.0.0
 */
public final class AlertNotification {

    private final AnomalyAlert alert;
    private final boolean shouldNotify;
    private final String reason;
    private final Integer convergedCount;

    private AlertNotification(AnomalyAlert alert, boolean shouldNotify, String reason, Integer convergedCount) {
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.shouldNotify = shouldNotify;
        this.reason = reason;
        this.convergedCount = convergedCount;
    }

    static AlertNotification notify(AnomalyAlert alert) {
        return new AlertNotification(alert, true, null, null);
    }

    static AlertNotification suppressed(AnomalyAlert alert, String reason) {
        return new AlertNotification(alert, false, Objects.requireNonNull(reason, "reason must not be null"), null);
    }

    static AlertNotification converged(AnomalyAlert alert, int count) {
        return new AlertNotification(alert, false, "Alert converged", count);
    }

    public AnomalyAlert getAlert() {
        return alert;
    }

    public boolean shouldNotify() {
        return shouldNotify;
    }

    /** @return why the alert was suppressed; empty when it is surfaced */
    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    /** @return size of the convergence group, only for converged alerts */
    public OptionalInt getConvergedCount() {
        return convergedCount == null ? OptionalInt.empty() : OptionalInt.of(convergedCount);
    }

    @Override
    public String toString() {
        return "AlertNotification{alert=" + alert.getId() + ", shouldNotify=" + shouldNotify
                + (reason != null ? ", reason='" + reason + '\'' : "") + '}';
    }
}
