package com.qualitysentinel.core.algorithms;

import com.qualitysentinel.core.model.DataPoint;
import com.qualitysentinel.core.stats.Statistics;
import com.qualitysentinel.core.stats.SummaryStats;

import java.util.ArrayList;
import java.util.List;

/**
 * Interquartile-range (Tukey fence) outlier test.
 *
 * <p>
 * Quartiles are read at index {@code floor(n·0.25)} and {@code floor(n·0.75)}
 * of the sorted history, so {@code [1..10]} gives {@code q1 = 3},
 * {@code q3 = 8}. The deviation of an outlier is the distance beyond the
 * nearer fence in IQR units; it is {@code 0} inside the fences and when the
 * IQR is zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class Iqr {

    public static final double DEFAULT_MULTIPLIER = 1.5;

    private Iqr() {
        // utility class
    }

    /**
     * Result of a single-value test.
     */
    public static final class Result {
        private final boolean high;
        private final boolean low;
        private final double deviation;
        private final IqrStats stats;

        Result(boolean high, boolean low, double deviation, IqrStats stats) {
            this.high = high;
            this.low = low;
            this.deviation = deviation;
            this.stats = stats;
        }

        public boolean isAnomaly() {
            return high || low;
        }

        public boolean isHigh() {
            return high;
        }

        public boolean isLow() {
            return low;
        }

        /** @return signed distance beyond the nearer fence, in IQR units */
        public double getDeviation() {
            return deviation;
        }

        public IqrStats getStats() {
            return stats;
        }

        @Override
        public String toString() {
            return "Iqr.Result{high=" + high + ", low=" + low + ", deviation=" + deviation + '}';
        }
    }

    public static IqrStats stats(double[] data) {
        return stats(data, DEFAULT_MULTIPLIER);
    }

    public static IqrStats stats(double[] data, double multiplier) {
        SummaryStats s = Statistics.summarize(data);
        return new IqrStats(s.getQ1(), s.getMedian(), s.getQ3(), multiplier);
    }

    public static Result detect(double value, double[] history) {
        return detect(value, history, DEFAULT_MULTIPLIER);
    }

    public static Result detect(double value, double[] history, double multiplier) {
        return detect(value, stats(history, multiplier));
    }

    public static Result detect(double value, IqrStats stats) {
        boolean high = value > stats.getUpperBound();
        boolean low = value < stats.getLowerBound();
        double deviation = 0;
        if (high) {
            deviation = Statistics.safeDivide(value - stats.getUpperBound(), stats.getIqr());
        } else if (low) {
            deviation = Statistics.safeDivide(value - stats.getLowerBound(), stats.getIqr());
        }
        return new Result(high, low, deviation, stats);
    }

    /**
     * Scan a series against its own fences.
     */
    public static List<AnomalyPoint> detectAll(List<DataPoint> data, double multiplier) {
        double[] values = new double[data.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = data.get(i).getValue();
        }
        IqrStats stats = stats(values, multiplier);
        List<AnomalyPoint> out = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            Result r = detect(values[i], stats);
            if (r.isAnomaly()) {
                out.add(new AnomalyPoint(i, values[i], r.getDeviation(), data.get(i).getTimestamp()));
            }
        }
        return out;
    }

    /**
     * @return percentage of {@code data} outside its own fences, {@code 0} when empty
     */
    public static double anomalyPercentage(double[] data, double multiplier) {
        if (data.length == 0) {
            return 0;
        }
        IqrStats stats = stats(data, multiplier);
        int count = 0;
        for (double v : data) {
            if (detect(v, stats).isAnomaly()) {
                count++;
            }
        }
        return 100.0 * count / data.length;
    }
}
