package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Human-readable alert rendered from an anomaly or a health-score drop.
 *
 * <p>
 * Serialized to JSON and published to the configured Kafka alerts topic.
 * Every field is fixed at construction except the acknowledgement pair,
 * which is set once by {@link #acknowledge(Instant)}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnomalyAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String anomalyId;
    private final AlertLevel level;
    private final String title;
    private final String message;
    private final Instant createdAt;

    private boolean acknowledged;
    private Instant acknowledgedAt;

    private AnomalyAlert(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.anomalyId = Objects.requireNonNull(b.anomalyId, "anomalyId must not be null");
        this.level = Objects.requireNonNull(b.level, "level must not be null");
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.message = b.message == null ? "" : b.message;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mark the alert as acknowledged. Acknowledging twice is a no-op and keeps
     * the first acknowledgement time.
     *
     * @param at acknowledgement time
     * @return {@code true} if this call acknowledged the alert
     */
    public synchronized boolean acknowledge(Instant at) {
        Objects.requireNonNull(at, "acknowledgement time must not be null");
        if (acknowledged) {
            return false;
        }
        acknowledged = true;
        acknowledgedAt = at;
        return true;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public AlertLevel getLevel() {
        return level;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized boolean isAcknowledged() {
        return acknowledged;
    }

    /** @return acknowledgement time, or {@code null} while unacknowledged */
    public synchronized Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyAlert that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AnomalyAlert{" +
                "id='" + id + '\'' +
                ", anomalyId='" + anomalyId + '\'' +
                ", level=" + level +
                ", title='" + title + '\'' +
                ", createdAt=" + createdAt +
                ", acknowledged=" + isAcknowledged() +
                '}';
    }

    /**
     * Fluent builder for {@link AnomalyAlert}.
     */
    public static class Builder {
        private String id;
        private String anomalyId;
        private AlertLevel level;
        private String title;
        private String message;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder anomalyId(String anomalyId) {
            this.anomalyId = anomalyId;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AnomalyAlert build() {
            return new AnomalyAlert(this);
        }
    }
}
