package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.Anomaly;

import java.util.List;
import java.util.Objects;

/**
 * Anomalies found across the metrics of one test case.
 *
 * @since 1.0.0
 */
public final class CaseDetectionResult {

    private final String caseId;
    private final List<Anomaly> anomalies;
    private final OverallStatus overallStatus;

    public CaseDetectionResult(String caseId, List<Anomaly> anomalies) {
        this.caseId = Objects.requireNonNull(caseId, "caseId must not be null");
        this.anomalies = List.copyOf(anomalies);
        this.overallStatus = OverallStatus.of(this.anomalies);
    }

    public String getCaseId() {
        return caseId;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public OverallStatus getOverallStatus() {
        return overallStatus;
    }

    @Override
    public String toString() {
        return "CaseDetectionResult{caseId='" + caseId + "', anomalies=" + anomalies.size()
                + ", status=" + overallStatus + '}';
    }
}
