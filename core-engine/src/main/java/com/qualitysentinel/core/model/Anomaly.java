package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A detected deviation of one metric from its baseline.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * An anomaly is created in {@link AnomalyStatus#NEW} and changes only through
 * {@link #transitionTo(AnomalyStatus, Instant)} and its shortcuts.
 * {@link AnomalyStatus#RESOLVED} is terminal: any attempt to leave it raises
 * {@link IllegalStateException}. Moving to the current status is a no-op.
 * </p>
 *
 * <h3>Root causes</h3>
 * <p>
 * {@link #addRootCauses(Collection)} only appends. Readers may iterate
 * {@link #getRootCauses()} while an analyzer is appending.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final AnomalyType type;
    private final Severity severity;
    private final Instant detectedAt;
    private final String metricName;
    private final double currentValue;
    private final double expectedValue;
    private final double deviation;
    private final String caseId;
    private final String caseName;
    private final String description;
    private final SeverityResult severityResult;

    private final CopyOnWriteArrayList<RootCause> rootCauses = new CopyOnWriteArrayList<>();

    private AnomalyStatus status;
    private Instant acknowledgedAt;
    private Instant resolvedAt;

    private Anomaly(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.detectedAt = Objects.requireNonNull(b.detectedAt, "detectedAt must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.currentValue = b.currentValue;
        this.expectedValue = b.expectedValue;
        this.deviation = b.deviation;
        this.caseId = b.caseId;
        this.caseName = b.caseName;
        this.description = b.description == null ? "" : b.description;
        this.severityResult = b.severityResult;
        this.acknowledgedAt = b.acknowledgedAt;
        this.resolvedAt = b.resolvedAt;
        if (b.rootCauses != null) {
            this.rootCauses.addAll(b.rootCauses);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Status transitions
    // ---------------------------------------------------------------

    /**
     * Move this anomaly to {@code target}.
     *
     * @param target new status
     * @param at     time of the transition, recorded for acknowledge and resolve
     * @return {@code true} if the status changed, {@code false} if it already
     *         was {@code target}
     * @throws IllegalStateException if the anomaly is resolved and
     *                               {@code target} is a different status
     */
    public synchronized boolean transitionTo(AnomalyStatus target, Instant at) {
        Objects.requireNonNull(target, "target status must not be null");
        Objects.requireNonNull(at, "transition time must not be null");
        if (status == target) {
            return false;
        }
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Anomaly " + id + " is " + status.id() + " and cannot move to " + target.id());
        }
        if (target == AnomalyStatus.ACKNOWLEDGED && acknowledgedAt == null) {
            acknowledgedAt = at;
        }
        if (target == AnomalyStatus.RESOLVED) {
            resolvedAt = at;
        }
        status = target;
        return true;
    }

    public boolean acknowledge(Instant at) {
        return transitionTo(AnomalyStatus.ACKNOWLEDGED, at);
    }

    public boolean investigate(Instant at) {
        return transitionTo(AnomalyStatus.INVESTIGATING, at);
    }

    public boolean resolve(Instant at) {
        return transitionTo(AnomalyStatus.RESOLVED, at);
    }

    /**
     * Append root causes. Existing entries are never replaced or removed.
     *
     * @param causes causes to append; {@code null} elements are rejected
     */
    public void addRootCauses(Collection<RootCause> causes) {
        Objects.requireNonNull(causes, "causes must not be null");
        for (RootCause cause : causes) {
            Objects.requireNonNull(cause, "root cause must not be null");
        }
        rootCauses.addAll(causes);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public AnomalyType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public synchronized AnomalyStatus getStatus() {
        return status;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getDeviation() {
        return deviation;
    }

    public Optional<String> getCaseId() {
        return Optional.ofNullable(caseId);
    }

    public Optional<String> getCaseName() {
        return Optional.ofNullable(caseName);
    }

    public String getDescription() {
        return description;
    }

    public Optional<SeverityResult> getSeverityResult() {
        return Optional.ofNullable(severityResult);
    }

    /** @return read-only view of the attached root causes */
    public List<RootCause> getRootCauses() {
        return Collections.unmodifiableList(rootCauses);
    }

    public synchronized Optional<Instant> getAcknowledgedAt() {
        return Optional.ofNullable(acknowledgedAt);
    }

    public synchronized Optional<Instant> getResolvedAt() {
        return Optional.ofNullable(resolvedAt);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", status=" + getStatus() +
                ", metricName='" + metricName + '\'' +
                ", currentValue=" + currentValue +
                ", expectedValue=" + expectedValue +
                ", deviation=" + deviation +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Anomaly}.
     *
     * <p>
     * {@code id}, {@code type}, {@code severity}, {@code detectedAt} and
     * {@code metricName} are required. Status defaults to
     * {@link AnomalyStatus#NEW}.
     * </p>
     */
    public static class Builder {
        private String id;
        private AnomalyType type;
        private Severity severity;
        private AnomalyStatus status = AnomalyStatus.NEW;
        private Instant detectedAt;
        private String metricName;
        private double currentValue;
        private double expectedValue;
        private double deviation;
        private String caseId;
        private String caseName;
        private String description;
        private SeverityResult severityResult;
        private List<RootCause> rootCauses;
        private Instant acknowledgedAt;
        private Instant resolvedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(AnomalyStatus status) {
            this.status = status;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder caseId(String caseId) {
            this.caseId = caseId;
            return this;
        }

        public Builder caseName(String caseName) {
            this.caseName = caseName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severityResult(SeverityResult severityResult) {
            this.severityResult = severityResult;
            return this;
        }

        public Builder rootCauses(List<RootCause> rootCauses) {
            this.rootCauses = rootCauses;
            return this;
        }

        public Builder acknowledgedAt(Instant acknowledgedAt) {
            this.acknowledgedAt = acknowledgedAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException if a required field is missing
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }
}
