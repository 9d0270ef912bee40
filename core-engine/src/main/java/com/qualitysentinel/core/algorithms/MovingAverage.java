package com.qualitysentinel.core.algorithms;

import com.qualitysentinel.core.model.DataPoint;
import com.qualitysentinel.core.stats.Statistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Trailing moving-average tests and Bollinger bands.
 *
 * @since 1.0.0
 */
public final class MovingAverage {

    public static final int DEFAULT_WINDOW = 10;
    public static final double DEFAULT_THRESHOLD = 2.0;
    public static final double DEFAULT_ALPHA = 0.2;
    public static final int DEFAULT_BAND_WINDOW = 20;
    public static final double DEFAULT_BAND_MULTIPLIER = 2.0;

    private MovingAverage() {
        // utility class
    }

    /**
     * Result of a single-value test.
     */
    public static final class Result {
        private final boolean anomaly;
        private final double currentValue;
        private final double movingAverage;
        private final double deviation;
        private final double zScore;
        private final double percentageDeviation;

        Result(boolean anomaly, double currentValue, double movingAverage, double deviation,
                double zScore, double percentageDeviation) {
            this.anomaly = anomaly;
            this.currentValue = currentValue;
            this.movingAverage = movingAverage;
            this.deviation = deviation;
            this.zScore = zScore;
            this.percentageDeviation = percentageDeviation;
        }

        public boolean isAnomaly() {
            return anomaly;
        }

        public double getCurrentValue() {
            return currentValue;
        }

        public double getMovingAverage() {
            return movingAverage;
        }

        /** @return {@code value - movingAverage} in raw units */
        public double getDeviation() {
            return deviation;
        }

        /** @return deviation divided by the trailing stdDev */
        public double getZScore() {
            return zScore;
        }

        public double getPercentageDeviation() {
            return percentageDeviation;
        }

        @Override
        public String toString() {
            return "MovingAverage.Result{anomaly=" + anomaly + ", movingAverage=" + movingAverage
                    + ", zScore=" + zScore + '}';
        }
    }

    /**
     * Simple moving average over trailing windows truncated at the start.
     * A series shorter than the window gets its overall mean everywhere.
     */
    public static double[] sma(double[] values, int windowSize) {
        double[] out = new double[values.length];
        if (values.length < windowSize) {
            Arrays.fill(out, Statistics.mean(values));
            return out;
        }
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - windowSize + 1);
            out[i] = Statistics.mean(Arrays.copyOfRange(values, start, i + 1));
        }
        return out;
    }

    public static double[] ema(double[] values, double alpha) {
        double[] out = new double[values.length];
        if (values.length == 0) {
            return out;
        }
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = alpha * values[i] + (1 - alpha) * out[i - 1];
        }
        return out;
    }

    /**
     * Population stdDev over trailing windows. A series shorter than the
     * window gets its overall stdDev everywhere.
     */
    public static double[] movingStdDev(double[] values, int windowSize) {
        double[] out = new double[values.length];
        if (values.length < windowSize) {
            Arrays.fill(out, Statistics.stdDev(values));
            return out;
        }
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - windowSize + 1);
            out[i] = Statistics.stdDev(Arrays.copyOfRange(values, start, i + 1));
        }
        return out;
    }

    public static Result detect(double value, double[] history) {
        return detect(value, history, DEFAULT_WINDOW, DEFAULT_THRESHOLD, false, DEFAULT_ALPHA);
    }

    /**
     * Compare {@code value} with the moving average that precedes it.
     *
     * @param value          candidate value
     * @param history        values observed before {@code value}, oldest first
     * @param windowSize     trailing window
     * @param threshold      z-score limit
     * @param useExponential use an EMA instead of an SMA
     * @param alpha          EMA smoothing factor
     * @return anomalous when {@code |(value - ma) / trailingStdDev| > threshold}
     */
    public static Result detect(double value, double[] history, int windowSize, double threshold,
            boolean useExponential, double alpha) {
        if (history.length == 0) {
            return new Result(false, value, value, 0, 0, 0);
        }
        double[] series = Arrays.copyOf(history, history.length + 1);
        series[history.length] = value;
        double[] ma = useExponential ? ema(series, alpha) : sma(series, windowSize);
        double movingAverage = ma[ma.length - 2];
        double[] stdDevs = movingStdDev(history, windowSize);
        double stdDev = stdDevs[stdDevs.length - 1];

        double deviation = value - movingAverage;
        double z = Statistics.safeDivide(deviation, stdDev);
        double pct = Statistics.safeDivide(deviation, movingAverage) * 100;
        return new Result(Math.abs(z) > threshold, value, movingAverage, deviation, z, pct);
    }

    /**
     * Scan a series after a warm-up of {@code windowSize} points, comparing
     * each point with the average and stdDev ending just before it.
     */
    public static List<AnomalyPoint> detectAll(List<DataPoint> data, int windowSize, double threshold,
            boolean useExponential, double alpha) {
        if (data.size() < windowSize) {
            return List.of();
        }
        double[] values = values(data);
        double[] ma = useExponential ? ema(values, alpha) : sma(values, windowSize);
        double[] stdDevs = movingStdDev(values, windowSize);
        List<AnomalyPoint> out = new ArrayList<>();
        for (int i = windowSize; i < values.length; i++) {
            double z = Statistics.safeDivide(values[i] - ma[i - 1], stdDevs[i - 1]);
            if (Math.abs(z) > threshold) {
                out.add(new AnomalyPoint(i, values[i], z, data.get(i).getTimestamp()));
            }
        }
        return out;
    }

    public static BollingerBands bollinger(double[] values, int windowSize, double multiplier) {
        double[] middle = sma(values, windowSize);
        double[] stdDevs = movingStdDev(values, windowSize);
        double[] upper = new double[values.length];
        double[] lower = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            upper[i] = middle[i] + multiplier * stdDevs[i];
            lower[i] = middle[i] - multiplier * stdDevs[i];
        }
        return new BollingerBands(upper, middle, lower);
    }

    /**
     * Points outside the Bollinger bands after a warm-up of
     * {@code windowSize}. The deviation is the distance past the nearer band
     * divided by the half band width.
     */
    public static List<AnomalyPoint> detectBollinger(List<DataPoint> data, int windowSize, double multiplier) {
        double[] values = values(data);
        BollingerBands bands = bollinger(values, windowSize, multiplier);
        List<AnomalyPoint> out = new ArrayList<>();
        for (int i = windowSize; i < values.length; i++) {
            double v = values[i];
            if (v > bands.upper(i)) {
                double d = Statistics.safeDivide(v - bands.upper(i), bands.upper(i) - bands.middle(i));
                out.add(new AnomalyPoint(i, v, d, data.get(i).getTimestamp()));
            } else if (v < bands.lower(i)) {
                double d = Statistics.safeDivide(v - bands.lower(i), bands.middle(i) - bands.lower(i));
                out.add(new AnomalyPoint(i, v, d, data.get(i).getTimestamp()));
            }
        }
        return out;
    }

    private static double[] values(List<DataPoint> data) {
        double[] values = new double[data.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = data.get(i).getValue();
        }
        return values;
    }
}
