package com.qualitysentinel.core.alert;

import com.qualitysentinel.core.model.Severity;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable alerting policy.
 *
 * <p>
 * Defaults: enabled, minimum severity {@link Severity#LOW}, 5 minute
 * deduplication window, 15 minute convergence window, at most 5 alerts per
 * title per window, 30 minute cooldown.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertConfig {

    private static final AlertConfig DEFAULTS = builder().build();

    private final boolean enabled;
    private final Severity minSeverity;
    private final Duration deduplicationWindow;
    private final Duration convergenceWindow;
    private final int maxAlertsPerWindow;
    private final Duration cooldownPeriod;

    private AlertConfig(Builder b) {
        this.enabled = b.enabled;
        this.minSeverity = b.minSeverity;
        this.deduplicationWindow = b.deduplicationWindow;
        this.convergenceWindow = b.convergenceWindow;
        this.maxAlertsPerWindow = b.maxAlertsPerWindow;
        this.cooldownPeriod = b.cooldownPeriod;
    }

    public static AlertConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .minSeverity(minSeverity)
                .deduplicationWindow(deduplicationWindow)
                .convergenceWindow(convergenceWindow)
                .maxAlertsPerWindow(maxAlertsPerWindow)
                .cooldownPeriod(cooldownPeriod);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Severity getMinSeverity() {
        return minSeverity;
    }

    public Duration getDeduplicationWindow() {
        return deduplicationWindow;
    }

    public Duration getConvergenceWindow() {
        return convergenceWindow;
    }

    public int getMaxAlertsPerWindow() {
        return maxAlertsPerWindow;
    }

    public Duration getCooldownPeriod() {
        return cooldownPeriod;
    }

    @Override
    public String toString() {
        return "AlertConfig{enabled=" + enabled + ", minSeverity=" + minSeverity
                + ", dedup=" + deduplicationWindow + ", convergence=" + convergenceWindow
                + ", maxAlertsPerWindow=" + maxAlertsPerWindow + ", cooldown=" + cooldownPeriod + '}';
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static class Builder {

        private boolean enabled = true;
        private Severity minSeverity = Severity.LOW;
        private Duration deduplicationWindow = Duration.ofMinutes(5);
        private Duration convergenceWindow = Duration.ofMinutes(15);
        private int maxAlertsPerWindow = 5;
        private Duration cooldownPeriod = Duration.ofMinutes(30);

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder minSeverity(Severity minSeverity) {
            this.minSeverity = minSeverity;
            return this;
        }

        public Builder deduplicationWindow(Duration window) {
            this.deduplicationWindow = window;
            return this;
        }

        public Builder convergenceWindow(Duration window) {
            this.convergenceWindow = window;
            return this;
        }

        public Builder maxAlertsPerWindow(int max) {
            this.maxAlertsPerWindow = max;
            return this;
        }

        public Builder cooldownPeriod(Duration period) {
            this.cooldownPeriod = period;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a window is not positive or
         *                                  {@code maxAlertsPerWindow < 1}
         */
        public AlertConfig build() {
            Objects.requireNonNull(minSeverity, "minSeverity must not be null");
            requirePositive("deduplicationWindow", deduplicationWindow);
            requirePositive("convergenceWindow", convergenceWindow);
            requirePositive("cooldownPeriod", cooldownPeriod);
            if (maxAlertsPerWindow < 1) {
                throw new IllegalArgumentException("maxAlertsPerWindow must be >= 1, got: " + maxAlertsPerWindow);
            }
            return new AlertConfig(this);
        }

        private static void requirePositive(String name, Duration d) {
            Objects.requireNonNull(d, name + " must not be null");
            if (d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + d);
            }
        }
    }
}
