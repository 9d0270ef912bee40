package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of scoring an anomaly candidate.
 *
 * <p>
 * Derived data: it is embedded in the {@link Anomaly} it was computed for and
 * never stored on its own.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Severity severity;
    private final double score;
    private final List<SeverityFactor> factors;
    private final String recommendation;

    /**
     * @param severity       bucketed severity class
     * @param score          numeric score; must lie in {@code [0, 100]}
     * @param factors        contributing factors, copied
     * @param recommendation human-readable next step
     * @throws IllegalArgumentException if {@code score} is outside
     *                                  {@code [0, 100]}
     */
    public SeverityResult(Severity severity, double score, List<SeverityFactor> factors, String recommendation) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        if (!(score >= 0 && score <= 100)) {
            throw new IllegalArgumentException("score must be within [0, 100], got: " + score);
        }
        this.score = score;
        this.factors = List.copyOf(Objects.requireNonNull(factors, "factors must not be null"));
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation must not be null");
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getScore() {
        return score;
    }

    /** @return unmodifiable list of factors */
    public List<SeverityFactor> getFactors() {
        return factors;
    }

    public String getRecommendation() {
        return recommendation;
    }

    @Override
    public String toString() {
        return "SeverityResult{" +
                "severity=" + severity +
                ", score=" + score +
                ", factors=" + factors.size() +
                ", recommendation='" + recommendation + '\'' +
                '}';
    }
}
