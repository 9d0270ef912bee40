package com.qualitysentinel.core.severity;

import java.util.Locale;
import java.util.Objects;

/**
 * Scope and urgency of an anomaly, derived from how many cases it touches.
 *
 * @since 1.0.0
 */
public final class ImpactAssessment {

    /** Share of affected cases: under 5%, 5-20%, 20-50%, 50% and more. */
    public enum Scope {
        LOW, MEDIUM, HIGH, CRITICAL;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Urgency {
        LOW, MEDIUM, HIGH, IMMEDIATE;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Scope scope;
    private final double affectedPercentage;
    private final String estimatedImpact;
    private final Urgency urgency;

    public ImpactAssessment(Scope scope, double affectedPercentage, String estimatedImpact, Urgency urgency) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.affectedPercentage = affectedPercentage;
        this.estimatedImpact = Objects.requireNonNull(estimatedImpact, "estimatedImpact must not be null");
        this.urgency = Objects.requireNonNull(urgency, "urgency must not be null");
    }

    public Scope getScope() {
        return scope;
    }

    /** @return affected share in percent, {@code 0} when counts were not supplied */
    public double getAffectedPercentage() {
        return affectedPercentage;
    }

    public String getEstimatedImpact() {
        return estimatedImpact;
    }

    public Urgency getUrgency() {
        return urgency;
    }

    @Override
    public String toString() {
        return "ImpactAssessment{scope=" + scope + ", urgency=" + urgency + ", '" + estimatedImpact + "'}";
    }
}
