package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.detection.Algorithm;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.Baseline;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one detection call.
 *
 * <p>
 * Callers must check {@link #getStatus()} first: for
 * {@link Status#INSUFFICIENT_DATA} and {@link Status#DISABLED} every other
 * field is a placeholder.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    public enum Status {
        /** Detection is switched off in the config. */
        DISABLED,
        /** No baseline and too little history to judge. */
        INSUFFICIENT_DATA,
        NORMAL,
        ANOMALY;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Status status;
    private final Algorithm algorithm;
    private final double deviation;
    private final double threshold;
    private final Baseline baseline;
    private final Anomaly anomaly;

    private DetectionResult(Status status, Algorithm algorithm, double deviation, double threshold,
            Baseline baseline, Anomaly anomaly) {
        this.status = status;
        this.algorithm = algorithm;
        this.deviation = deviation;
        this.threshold = threshold;
        this.baseline = baseline;
        this.anomaly = anomaly;
    }

    static DetectionResult disabled() {
        return new DetectionResult(Status.DISABLED, null, 0, 0, null, null);
    }

    static DetectionResult insufficientData() {
        return new DetectionResult(Status.INSUFFICIENT_DATA, null, 0, 0, null, null);
    }

    static DetectionResult normal(double deviation, double threshold, Baseline baseline) {
        return new DetectionResult(Status.NORMAL, null, deviation, threshold, baseline, null);
    }

    static DetectionResult anomaly(Algorithm algorithm, Anomaly anomaly, double threshold, Baseline baseline) {
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        return new DetectionResult(Status.ANOMALY, algorithm, anomaly.getDeviation(), threshold, baseline, anomaly);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAnomaly() {
        return status == Status.ANOMALY;
    }

    /** @return the algorithm that produced the primary signal, for anomalies only */
    public Optional<Algorithm> getAlgorithm() {
        return Optional.ofNullable(algorithm);
    }

    /**
     * Label for logs and payloads: the algorithm id for anomalies,
     * {@code "all"} for normal results, {@code "none"} when disabled and
     * {@code "insufficient_data"}.
     */
    public String getAlgorithmLabel() {
        return switch (status) {
            case DISABLED -> "none";
            case INSUFFICIENT_DATA -> "insufficient_data";
            case NORMAL -> "all";
            case ANOMALY -> algorithm.id();
        };
    }

    public double getDeviation() {
        return deviation;
    }

    public double getThreshold() {
        return threshold;
    }

    public Optional<Baseline> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    public Optional<Anomaly> getAnomaly() {
        return Optional.ofNullable(anomaly);
    }

    @Override
    public String toString() {
        return "DetectionResult{" + status.id() + ", algorithm=" + getAlgorithmLabel()
                + ", deviation=" + deviation + '}';
    }
}
