package com.qualitysentinel.core.engine;

import java.util.OptionalDouble;

/**
 * Per-concern thresholds carried in a {@link DetectionConfig}.
 *
 * <p>
 * The z-score threshold is unset by default, in which case the sensitivity
 * decides it.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionThresholds {

    private static final DetectionThresholds DEFAULTS = builder().build();

    private final Double zScore;
    private final double passRateDrop;
    private final int consecutiveFailures;
    private final double flakyScore;

    private DetectionThresholds(Builder b) {
        this.zScore = b.zScore;
        this.passRateDrop = b.passRateDrop;
        this.consecutiveFailures = b.consecutiveFailures;
        this.flakyScore = b.flakyScore;
    }

    public static DetectionThresholds defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return explicit z-score threshold, empty when the sensitivity applies */
    public OptionalDouble getZScore() {
        return zScore != null ? OptionalDouble.of(zScore) : OptionalDouble.empty();
    }

    /** Fractional pass-rate change between windows, e.g. {@code 0.2} = 20 points. */
    public double getPassRateDrop() {
        return passRateDrop;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public double getFlakyScore() {
        return flakyScore;
    }

    @Override
    public String toString() {
        return "DetectionThresholds{zScore=" + zScore + ", passRateDrop=" + passRateDrop
                + ", consecutiveFailures=" + consecutiveFailures
                + ", flakyScore=" + flakyScore + '}';
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static class Builder {

        private Double zScore;
        private double passRateDrop = 0.2;
        private int consecutiveFailures = 3;
        private double flakyScore = 0.3;

        private Builder() {
        }

        /** @param v overrides the sensitivity threshold; {@code null} clears the override */
        public Builder zScore(Double v) {
            this.zScore = v;
            return this;
        }

        public Builder passRateDrop(double v) {
            this.passRateDrop = v;
            return this;
        }

        public Builder consecutiveFailures(int v) {
            this.consecutiveFailures = v;
            return this;
        }

        public Builder flakyScore(double v) {
            this.flakyScore = v;
            return this;
        }

        public DetectionThresholds build() {
            if (zScore != null && !(zScore > 0)) {
                throw new IllegalArgumentException("zScore must be > 0, got: " + zScore);
            }
            if (passRateDrop <= 0 || passRateDrop > 1) {
                throw new IllegalArgumentException("passRateDrop must be within (0, 1], got: " + passRateDrop);
            }
            if (consecutiveFailures < 1) {
                throw new IllegalArgumentException(
                        "consecutiveFailures must be >= 1, got: " + consecutiveFailures);
            }
            if (flakyScore <= 0 || flakyScore > 1) {
                throw new IllegalArgumentException("flakyScore must be within (0, 1], got: " + flakyScore);
            }
            return new DetectionThresholds(this);
        }
    }
}
