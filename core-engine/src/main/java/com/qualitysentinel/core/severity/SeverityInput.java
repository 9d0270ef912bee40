package com.qualitysentinel.core.severity;

import com.qualitysentinel.core.model.AnomalyType;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Everything the {@link SeverityEvaluator} scores.
 *
 * <p>
 * Only {@code deviation} and {@code type} are required. Optional factors that
 * are left unset contribute nothing to the score.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityInput {

    private final double deviation;
    private final AnomalyType type;
    private final Duration duration;
    private final Integer affectedCases;
    private final Integer totalCases;
    private final boolean regression;
    private final Integer consecutiveFailures;
    private final Double historicalFrequency;

    private SeverityInput(Builder b) {
        this.deviation = b.deviation;
        this.type = b.type;
        this.duration = b.duration;
        this.affectedCases = b.affectedCases;
        this.totalCases = b.totalCases;
        this.regression = b.regression;
        this.consecutiveFailures = b.consecutiveFailures;
        this.historicalFrequency = b.historicalFrequency;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shortcut for the common case of a deviation and type only. */
    public static SeverityInput of(double deviation, AnomalyType type) {
        return builder().deviation(deviation).type(type).build();
    }

    public double getDeviation() {
        return deviation;
    }

    public AnomalyType getType() {
        return type;
    }

    public Optional<Duration> getDuration() {
        return Optional.ofNullable(duration);
    }

    /**
     * Affected share of the case population, in {@code [0, 1]}. Present only
     * when both counts were supplied.
     */
    public OptionalDouble getAffectedRatio() {
        if (affectedCases == null || totalCases == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) affectedCases / Math.max(totalCases, 1));
    }

    public boolean isRegression() {
        return regression;
    }

    public OptionalInt getConsecutiveFailures() {
        return consecutiveFailures == null ? OptionalInt.empty() : OptionalInt.of(consecutiveFailures);
    }

    /** @return how often this anomaly recurred before, in {@code [0, 1]} */
    public OptionalDouble getHistoricalFrequency() {
        return historicalFrequency == null ? OptionalDouble.empty() : OptionalDouble.of(historicalFrequency);
    }

    @Override
    public String toString() {
        return "SeverityInput{deviation=" + deviation + ", type=" + type + ", regression=" + regression + '}';
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static class Builder {

        private double deviation;
        private AnomalyType type;
        private Duration duration;
        private Integer affectedCases;
        private Integer totalCases;
        private boolean regression;
        private Integer consecutiveFailures;
        private Double historicalFrequency;

        private Builder() {
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder impact(int affectedCases, int totalCases) {
            this.affectedCases = affectedCases;
            this.totalCases = totalCases;
            return this;
        }

        public Builder regression(boolean regression) {
            this.regression = regression;
            return this;
        }

        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }

        public Builder historicalFrequency(double historicalFrequency) {
            this.historicalFrequency = historicalFrequency;
            return this;
        }

        /**
         * @throws NullPointerException     if the type is missing
         * @throws IllegalArgumentException if a value is out of range
         */
        public SeverityInput build() {
            Objects.requireNonNull(type, "type must not be null");
            if (!Double.isFinite(deviation)) {
                throw new IllegalArgumentException("deviation must be finite, got: " + deviation);
            }
            if (duration != null && duration.isNegative()) {
                throw new IllegalArgumentException("duration must not be negative, got: " + duration);
            }
            if (affectedCases != null && (affectedCases < 0 || totalCases < 0)) {
                throw new IllegalArgumentException("case counts must be >= 0");
            }
            if (historicalFrequency != null && (historicalFrequency < 0 || historicalFrequency > 1)) {
                throw new IllegalArgumentException(
                        "historicalFrequency must be within [0, 1], got: " + historicalFrequency);
            }
            return new SeverityInput(this);
        }
    }
}
