package com.qualitysentinel.core.severity;

import com.qualitysentinel.core.model.SeverityResult;

import java.util.Objects;

/**
 * A severity result paired with its queue priority.
 *
 * @since 1.0.0
 */
public final class PrioritizedSeverity {

    private final SeverityInput input;
    private final SeverityResult result;
    private final double priority;

    public PrioritizedSeverity(SeverityInput input, SeverityResult result, double priority) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.result = Objects.requireNonNull(result, "result must not be null");
        this.priority = priority;
    }

    public SeverityInput getInput() {
        return input;
    }

    public SeverityResult getResult() {
        return result;
    }

    public double getPriority() {
        return priority;
    }

    @Override
    public String toString() {
        return "PrioritizedSeverity{" + result.getSeverity() + ", score=" + result.getScore()
                + ", priority=" + priority + '}';
    }
}
