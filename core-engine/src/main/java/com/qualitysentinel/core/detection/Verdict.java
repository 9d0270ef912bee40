package com.qualitysentinel.core.detection;

import java.util.Objects;

/**
 * One detector's opinion on a candidate value.
 *
 * @since 1.0.0
 */
public final class Verdict {

    private final Algorithm algorithm;
    private final boolean anomaly;
    private final double deviation;
    private final double expectedValue;

    public Verdict(Algorithm algorithm, boolean anomaly, double deviation, double expectedValue) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        this.anomaly = anomaly;
        this.deviation = Double.isFinite(deviation) ? deviation : 0;
        this.expectedValue = expectedValue;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    /** @return signed deviation in the algorithm's own units */
    public double getDeviation() {
        return deviation;
    }

    /** @return the centre the algorithm compared against */
    public double getExpectedValue() {
        return expectedValue;
    }

    @Override
    public String toString() {
        return "Verdict{" + algorithm.id() + ", anomaly=" + anomaly + ", deviation=" + deviation + '}';
    }
}
