package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A remediation step attached to a {@link RootCause}.
 *
 * @since 1.0.0
 */
public final class Suggestion implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Estimated cost of carrying out a suggestion. */
    public enum Effort {
        LOW, MEDIUM, HIGH
    }

    private final String action;
    private final int priority;
    private final Effort effort;

    public Suggestion(String action, int priority, Effort effort) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.priority = priority;
        this.effort = Objects.requireNonNull(effort, "effort must not be null");
    }

    public String getAction() {
        return action;
    }

    public int getPriority() {
        return priority;
    }

    public Effort getEffort() {
        return effort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Suggestion that))
            return false;
        return priority == that.priority && action.equals(that.action) && effort == that.effort;
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, priority, effort);
    }

    @Override
    public String toString() {
        return "Suggestion{action='" + action + "', priority=" + priority + ", effort=" + effort + '}';
    }
}
