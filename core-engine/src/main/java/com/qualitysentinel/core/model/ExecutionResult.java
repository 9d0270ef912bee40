package com.qualitysentinel.core.model;

import java.io.Serializable;

/**
 * Outcome of one test execution, used by the consecutive/flaky pattern
 * algorithms.
 *
 * @since 1.0.0
 */
public final class ExecutionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long timestamp;
    private final boolean passed;
    private final String caseId;

    public ExecutionResult(long timestamp, boolean passed, String caseId) {
        this.timestamp = timestamp;
        this.passed = passed;
        this.caseId = caseId;
    }

    public static ExecutionResult passed(long timestamp) {
        return new ExecutionResult(timestamp, true, null);
    }

    public static ExecutionResult failed(long timestamp) {
        return new ExecutionResult(timestamp, false, null);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isPassed() {
        return passed;
    }

    /** @return case identifier, or {@code null} when not tracked */
    public String getCaseId() {
        return caseId;
    }

    @Override
    public String toString() {
        return "ExecutionResult{timestamp=" + timestamp + ", passed=" + passed
                + ", caseId='" + caseId + "'}";
    }
}
