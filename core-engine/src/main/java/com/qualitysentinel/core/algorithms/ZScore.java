package com.qualitysentinel.core.algorithms;

import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.DataPoint;
import com.qualitysentinel.core.stats.Statistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Standard and modified (MAD-based) z-score tests.
 *
 * <p>
 * Both return a deviation of {@code 0} when the spread is zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class ZScore {

    public static final double DEFAULT_THRESHOLD = 3.0;

    private ZScore() {
        // utility class
    }

    /**
     * Result of a single-value test.
     */
    public static final class Result {
        private final boolean anomaly;
        private final double zScore;

        Result(boolean anomaly, double zScore) {
            this.anomaly = anomaly;
            this.zScore = zScore;
        }

        public boolean isAnomaly() {
            return anomaly;
        }

        public double getZScore() {
            return zScore;
        }

        @Override
        public String toString() {
            return "ZScore.Result{anomaly=" + anomaly + ", zScore=" + zScore + '}';
        }
    }

    public static Result detect(double value, Baseline baseline) {
        return detect(value, baseline, DEFAULT_THRESHOLD);
    }

    /**
     * @return anomalous when {@code |(value - mean) / stdDev| > threshold}
     */
    public static Result detect(double value, Baseline baseline, double threshold) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        double z = Statistics.zScore(value, baseline.getMean(), baseline.getStdDev());
        return new Result(Math.abs(z) > threshold, z);
    }

    /**
     * Scan a series against a baseline.
     *
     * @return the points whose z-score exceeds {@code threshold}, in order
     */
    public static List<AnomalyPoint> detectAll(List<DataPoint> data, Baseline baseline, double threshold) {
        List<AnomalyPoint> out = new ArrayList<>();
        for (int i = 0; i < data.size(); i++) {
            DataPoint p = data.get(i);
            Result r = detect(p.getValue(), baseline, threshold);
            if (r.isAnomaly()) {
                out.add(new AnomalyPoint(i, p.getValue(), r.getZScore(), p.getTimestamp()));
            }
        }
        return out;
    }

    /**
     * Modified z-score {@code 0.6745 · (value - median) / MAD} of
     * {@code value} against {@code history}.
     *
     * @return the score, {@code 0} when MAD is zero or history is empty
     */
    public static double modified(double value, double[] history) {
        if (history.length == 0) {
            return 0;
        }
        double median = Statistics.median(history);
        double mad = Statistics.mad(history);
        return Statistics.safeDivide(Statistics.MODIFIED_Z_FACTOR * (value - median), mad);
    }

    /**
     * @return anomalous when {@code |modified z| > threshold}
     */
    public static Result detectModified(double value, double[] history, double threshold) {
        double z = modified(value, history);
        return new Result(Math.abs(z) > threshold, z);
    }
}
