package com.qualitysentinel.core.severity;

import com.qualitysentinel.core.model.AnomalyType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tunable weights of the severity model.
 *
 * <p>
 * The four proportional weights scale their factor's {@code [0, 1]} value to
 * points out of 100. The regression penalty and consecutive-failure bonus are
 * absolute points. Type multipliers apply to the summed score; types without
 * an entry use {@code 1.0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityWeights {

    private static final SeverityWeights DEFAULTS = builder().build();

    private final double deviation;
    private final double duration;
    private final double frequency;
    private final double impact;
    private final double regressionPenalty;
    private final double consecutiveBonus;
    private final Map<AnomalyType, Double> typeMultipliers;

    private SeverityWeights(Builder b) {
        this.deviation = b.deviation;
        this.duration = b.duration;
        this.frequency = b.frequency;
        this.impact = b.impact;
        this.regressionPenalty = b.regressionPenalty;
        this.consecutiveBonus = b.consecutiveBonus;
        this.typeMultipliers = Collections.unmodifiableMap(new EnumMap<>(b.typeMultipliers));
    }

    public static SeverityWeights defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getDeviation() {
        return deviation;
    }

    public double getDuration() {
        return duration;
    }

    public double getFrequency() {
        return frequency;
    }

    public double getImpact() {
        return impact;
    }

    public double getRegressionPenalty() {
        return regressionPenalty;
    }

    public double getConsecutiveBonus() {
        return consecutiveBonus;
    }

    public double typeMultiplier(AnomalyType type) {
        return typeMultipliers.getOrDefault(type, 1.0);
    }

    public Map<AnomalyType, Double> getTypeMultipliers() {
        return typeMultipliers;
    }

    @Override
    public String toString() {
        return "SeverityWeights{deviation=" + deviation + ", duration=" + duration
                + ", frequency=" + frequency + ", impact=" + impact
                + ", regression=" + regressionPenalty + ", consecutive=" + consecutiveBonus + '}';
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static class Builder {

        private double deviation = 0.35;
        private double duration = 0.20;
        private double frequency = 0.15;
        private double impact = 0.30;
        private double regressionPenalty = 15;
        private double consecutiveBonus = 10;
        private final Map<AnomalyType, Double> typeMultipliers = new EnumMap<>(AnomalyType.class);

        private Builder() {
            typeMultipliers.put(AnomalyType.FAILURE_SPIKE, 1.3);
            typeMultipliers.put(AnomalyType.CONSECUTIVE_FAILURES, 1.3);
            typeMultipliers.put(AnomalyType.SUCCESS_RATE_DROP, 1.2);
            typeMultipliers.put(AnomalyType.PASS_RATE_DROP, 1.2);
            typeMultipliers.put(AnomalyType.PERFORMANCE_DEGRADATION, 1.1);
            typeMultipliers.put(AnomalyType.FLAKY_PATTERN, 0.9);
            typeMultipliers.put(AnomalyType.FLAKY_DETECTED, 0.9);
            typeMultipliers.put(AnomalyType.TREND_CHANGE, 0.8);
            typeMultipliers.put(AnomalyType.SEASONAL_DEVIATION, 0.7);
        }

        public Builder deviation(double weight) {
            this.deviation = weight;
            return this;
        }

        public Builder duration(double weight) {
            this.duration = weight;
            return this;
        }

        public Builder frequency(double weight) {
            this.frequency = weight;
            return this;
        }

        public Builder impact(double weight) {
            this.impact = weight;
            return this;
        }

        public Builder regressionPenalty(double points) {
            this.regressionPenalty = points;
            return this;
        }

        public Builder consecutiveBonus(double points) {
            this.consecutiveBonus = points;
            return this;
        }

        public Builder typeMultiplier(AnomalyType type, double multiplier) {
            typeMultipliers.put(Objects.requireNonNull(type, "type must not be null"), multiplier);
            return this;
        }

        /**
         * @throws IllegalArgumentException if any weight is negative or a
         *                                  multiplier is not positive
         */
        public SeverityWeights build() {
            requireNonNegative("deviation", deviation);
            requireNonNegative("duration", duration);
            requireNonNegative("frequency", frequency);
            requireNonNegative("impact", impact);
            requireNonNegative("regressionPenalty", regressionPenalty);
            requireNonNegative("consecutiveBonus", consecutiveBonus);
            typeMultipliers.forEach((type, m) -> {
                if (!(m > 0)) {
                    throw new IllegalArgumentException(
                            "type multiplier for " + type.id() + " must be > 0, got: " + m);
                }
            });
            return new SeverityWeights(this);
        }

        private static void requireNonNegative(String name, double value) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be a finite value >= 0, got: " + value);
            }
        }
    }
}
