package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Overall suite health reading produced by an external health scorer.
 *
 * @since 1.0.0
 */
public final class HealthScore implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double overall;
    private final Instant calculatedAt;

    /**
     * @param overall      score in {@code [0, 100]}
     * @param calculatedAt when the score was computed
     */
    public HealthScore(double overall, Instant calculatedAt) {
        if (!(overall >= 0 && overall <= 100)) {
            throw new IllegalArgumentException("overall must be within [0, 100], got: " + overall);
        }
        this.overall = overall;
        this.calculatedAt = Objects.requireNonNull(calculatedAt, "calculatedAt must not be null");
    }

    public double getOverall() {
        return overall;
    }

    public Instant getCalculatedAt() {
        return calculatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HealthScore that))
            return false;
        return Double.compare(overall, that.overall) == 0 && calculatedAt.equals(that.calculatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(overall, calculatedAt);
    }

    @Override
    public String toString() {
        return "HealthScore{overall=" + overall + ", calculatedAt=" + calculatedAt + '}';
    }
}
