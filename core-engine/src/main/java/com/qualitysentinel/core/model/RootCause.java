package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Explanation attached to an {@link Anomaly} by a root-cause analyzer.
 *
 * <p>
 * Produced outside this library; the alerting path only reads
 * {@code description} and {@code suggestions} to enrich message text.
 * </p>
 *
 * @since 1.0.0
 */
public final class RootCause implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final RootCauseCategory category;
    private final String description;
    private final double confidence;
    private final List<Suggestion> suggestions;

    /**
     * @param id          identifier
     * @param category    cause category
     * @param description human-readable explanation
     * @param confidence  confidence in {@code [0, 100]}
     * @param suggestions remediation steps, copied
     */
    public RootCause(String id, RootCauseCategory category, String description, double confidence,
            List<Suggestion> suggestions) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be within [0, 100], got: " + confidence);
        }
        this.confidence = confidence;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public String getId() {
        return id;
    }

    public RootCauseCategory getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<Suggestion> getSuggestions() {
        return suggestions;
    }

    @Override
    public String toString() {
        return "RootCause{" +
                "id='" + id + '\'' +
                ", category=" + category +
                ", confidence=" + confidence +
                ", description='" + description + '\'' +
                '}';
    }
}
