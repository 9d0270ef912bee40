package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Statistical summary describing the normal behaviour of one metric.
 *
 * <p>
 * Instances are immutable. A rebuild produces a new instance that replaces
 * the stored one; a baseline is never partially mutated.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code sampleCount > 0}: an empty baseline cannot be built</li>
 * <li>{@code stdDev >= 0} and finite</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class Baseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;
    private final int sampleCount;
    private final String period;
    private final Instant lastUpdated;

    // Optional percentile fields; null when the estimator does not produce them.
    private final Double p5;
    private final Double p25;
    private final Double median;
    private final Double p75;
    private final Double p95;

    private Baseline(Builder b) {
        this.mean = b.mean;
        this.stdDev = b.stdDev;
        this.min = b.min;
        this.max = b.max;
        this.sampleCount = b.sampleCount;
        this.period = b.period;
        this.lastUpdated = b.lastUpdated;
        this.p5 = b.p5;
        this.p25 = b.p25;
        this.median = b.median;
        this.p75 = b.p75;
        this.p95 = b.p95;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy this baseline into a new builder.
     *
     * @return builder pre-populated with every field of this baseline
     */
    public Builder toBuilder() {
        return new Builder()
                .mean(mean)
                .stdDev(stdDev)
                .min(min)
                .max(max)
                .sampleCount(sampleCount)
                .period(period)
                .lastUpdated(lastUpdated)
                .p5(p5)
                .p25(p25)
                .median(median)
                .p75(p75)
                .p95(p95);
    }

    /**
     * Scale the centre and spread by a multiplicative seasonal factor.
     *
     * <p>
     * Used to re-apply seasonality for a specific timestamp when a
     * deseasonalized baseline is compared against a live value.
     * </p>
     *
     * @param factor seasonal adjustment for the timestamp being evaluated
     * @return adjusted baseline, or {@code this} when {@code factor == 1}
     */
    public Baseline scaledBy(double factor) {
        if (factor == 1.0) {
            return this;
        }
        return toBuilder()
                .mean(mean * factor)
                .stdDev(stdDev * Math.abs(factor))
                .min(min * factor)
                .max(max * factor)
                .build();
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    /** @return window label such as {@code "4w"} */
    public String getPeriod() {
        return period;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public Optional<Double> getP5() {
        return Optional.ofNullable(p5);
    }

    public Optional<Double> getP25() {
        return Optional.ofNullable(p25);
    }

    public Optional<Double> getMedian() {
        return Optional.ofNullable(median);
    }

    public Optional<Double> getP75() {
        return Optional.ofNullable(p75);
    }

    public Optional<Double> getP95() {
        return Optional.ofNullable(p95);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Baseline that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && sampleCount == that.sampleCount
                && Objects.equals(period, that.period)
                && Objects.equals(lastUpdated, that.lastUpdated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev, min, max, sampleCount, period, lastUpdated);
    }

    @Override
    public String toString() {
        return "Baseline{" +
                "mean=" + mean +
                ", stdDev=" + stdDev +
                ", min=" + min +
                ", max=" + max +
                ", sampleCount=" + sampleCount +
                ", period='" + period + '\'' +
                ", lastUpdated=" + lastUpdated +
                '}';
    }

    /**
     * Fluent builder for {@link Baseline}.
     *
     * <p>
     * {@link #build()} rejects a non-positive {@code sampleCount}, a negative or
     * non-finite {@code stdDev} and a missing {@code lastUpdated}.
     * </p>
     */
    public static class Builder {
        private double mean;
        private double stdDev;
        private double min;
        private double max;
        private int sampleCount;
        private String period = "";
        private Instant lastUpdated;
        private Double p5;
        private Double p25;
        private Double median;
        private Double p75;
        private Double p95;

        public Builder mean(double v) {
            this.mean = v;
            return this;
        }

        public Builder stdDev(double v) {
            this.stdDev = v;
            return this;
        }

        public Builder min(double v) {
            this.min = v;
            return this;
        }

        public Builder max(double v) {
            this.max = v;
            return this;
        }

        public Builder sampleCount(int v) {
            this.sampleCount = v;
            return this;
        }

        public Builder period(String v) {
            this.period = v;
            return this;
        }

        public Builder lastUpdated(Instant v) {
            this.lastUpdated = v;
            return this;
        }

        public Builder p5(Double v) {
            this.p5 = v;
            return this;
        }

        public Builder p25(Double v) {
            this.p25 = v;
            return this;
        }

        public Builder median(Double v) {
            this.median = v;
            return this;
        }

        public Builder p75(Double v) {
            this.p75 = v;
            return this;
        }

        public Builder p95(Double v) {
            this.p95 = v;
            return this;
        }

        /**
         * Build and validate the baseline.
         *
         * @return a new {@link Baseline}
         * @throws IllegalArgumentException if an invariant is violated
         * @throws NullPointerException     if {@code lastUpdated} is missing
         */
        public Baseline build() {
            Objects.requireNonNull(lastUpdated, "lastUpdated must not be null");
            if (sampleCount <= 0) {
                throw new IllegalArgumentException("sampleCount must be > 0, got: " + sampleCount);
            }
            if (!Double.isFinite(stdDev) || stdDev < 0) {
                throw new IllegalArgumentException("stdDev must be finite and >= 0, got: " + stdDev);
            }
            if (!Double.isFinite(mean)) {
                throw new IllegalArgumentException("mean must be finite, got: " + mean);
            }
            return new Baseline(this);
        }
    }
}
