package com.qualitysentinel.core.stats;

import com.qualitysentinel.core.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Cleans raw metric series before baselines are fitted.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>sort by timestamp</li>
 * <li>optionally drop zero values</li>
 * <li>optionally drop z-score outliers (skipped below 3 points)</li>
 * <li>optionally interpolate gaps in the timeline</li>
 * <li>optionally normalize</li>
 * </ol>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class DataPreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(DataPreprocessor.class);

    /** Gap filling is skipped when the largest interval exceeds this multiple of the median interval. */
    static final double MAX_GAP_RATIO = 100;

    /** Only gaps wider than this multiple of the median interval are filled. */
    static final double GAP_FILL_RATIO = 1.5;

    static final double TREND_MIN_R_SQUARED = 0.3;
    static final double TREND_MIN_SLOPE = 0.01;

    /**
     * Run every step enabled in {@code config}.
     *
     * @param points raw series, in any order
     * @param config preprocessing options
     * @return the cleaned series and its statistics
     */
    public PreprocessResult preprocess(List<DataPoint> points, PreprocessConfig config) {
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(config, "config must not be null");

        List<DataPoint> data = new ArrayList<>(points);
        data.sort(Comparator.comparingLong(DataPoint::getTimestamp));
        int removed = 0;
        int filled = 0;

        if (config.isRemoveZeros()) {
            int before = data.size();
            data.removeIf(p -> p.getValue() == 0);
            removed += before - data.size();
        }

        if (config.isOutlierRemoval()) {
            int before = data.size();
            data = removeOutliers(data, config.getOutlierThreshold());
            removed += before - data.size();
        }

        if (config.isFillMissing() && data.size() >= 2) {
            int before = data.size();
            data = fillMissing(data, config.getFillMethod());
            filled = data.size() - before;
        }

        if (config.isNormalize()) {
            data = normalize(data, config.getNormalizeMethod());
        }

        if (removed > 0 || filled > 0) {
            LOG.debug("Preprocessed {} point(s): removed={}, filled={}", points.size(), removed, filled);
        }
        return new PreprocessResult(data, removed, filled, Statistics.summarize(values(data)));
    }

    /**
     * Drop points whose absolute z-score exceeds {@code threshold}.
     *
     * @return a new list; the input is returned unchanged below 3 points
     */
    public List<DataPoint> removeOutliers(List<DataPoint> data, double threshold) {
        if (data.size() < 3) {
            return data;
        }
        SummaryStats stats = Statistics.summarize(values(data));
        List<DataPoint> kept = new ArrayList<>(data.size());
        for (DataPoint p : data) {
            if (Math.abs(Statistics.zScore(p.getValue(), stats.getMean(), stats.getStdDev())) <= threshold) {
                kept.add(p);
            }
        }
        return kept;
    }

    /**
     * Drop points outside {@code [Q1 - k·IQR, Q3 + k·IQR]}.
     *
     * @return a new list; the input is returned unchanged below 4 points
     */
    public List<DataPoint> removeOutliersIqr(List<DataPoint> data, double multiplier) {
        if (data.size() < 4) {
            return data;
        }
        SummaryStats stats = Statistics.summarize(values(data));
        double lower = stats.getQ1() - multiplier * stats.getIqr();
        double upper = stats.getQ3() + multiplier * stats.getIqr();
        List<DataPoint> kept = new ArrayList<>(data.size());
        for (DataPoint p : data) {
            if (p.getValue() >= lower && p.getValue() <= upper) {
                kept.add(p);
            }
        }
        return kept;
    }

    /**
     * Insert synthetic points into gaps wider than 1.5× the median sampling
     * interval.
     *
     * <p>
     * Irregular series, where the widest gap exceeds 100× the median interval,
     * are returned unchanged.
     * </p>
     *
     * @param data   time-ordered series
     * @param method value source for synthetic points
     * @return series including the synthetic points
     */
    public List<DataPoint> fillMissing(List<DataPoint> data, PreprocessConfig.FillMethod method) {
        if (data.size() < 2) {
            return data;
        }
        long[] intervals = new long[data.size() - 1];
        for (int i = 1; i < data.size(); i++) {
            intervals[i - 1] = data.get(i).getTimestamp() - data.get(i - 1).getTimestamp();
        }
        Arrays.sort(intervals);
        long typical = intervals[intervals.length / 2];
        if (typical <= 0 || (double) intervals[intervals.length - 1] / typical > MAX_GAP_RATIO) {
            return data;
        }

        double mean = Statistics.mean(values(data));
        List<DataPoint> result = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            DataPoint current = data.get(i);
            result.add(current);
            if (i == data.size() - 1) {
                break;
            }
            DataPoint next = data.get(i + 1);
            long gap = next.getTimestamp() - current.getTimestamp();
            long expected = Math.round((double) gap / typical) - 1;
            if (expected <= 0 || gap <= typical * GAP_FILL_RATIO) {
                continue;
            }
            for (int j = 1; j <= expected; j++) {
                double fraction = (double) j / (expected + 1);
                long ts = current.getTimestamp() + Math.round(gap * fraction);
                double value = switch (method) {
                    case LINEAR -> current.getValue() + (next.getValue() - current.getValue()) * fraction;
                    case PREVIOUS -> current.getValue();
                    case MEAN -> mean;
                };
                result.add(DataPoint.of(ts, value));
            }
        }
        return result;
    }

    /**
     * Rescale values. A zero spread maps every value to {@code 0}.
     */
    public List<DataPoint> normalize(List<DataPoint> data, PreprocessConfig.NormalizeMethod method) {
        if (data.isEmpty()) {
            return data;
        }
        SummaryStats stats = Statistics.summarize(values(data));
        List<DataPoint> out = new ArrayList<>(data.size());
        for (DataPoint p : data) {
            double v = switch (method) {
                case ZSCORE -> Statistics.safeDivide(p.getValue() - stats.getMean(), stats.getStdDev());
                case MINMAX -> Statistics.safeDivide(p.getValue() - stats.getMin(), stats.getMax() - stats.getMin());
            };
            out.add(p.withValue(v));
        }
        return out;
    }

    /**
     * Map a normalized value back to the original scale.
     *
     * @param normalized value produced by {@link #normalize}
     * @param original   statistics of the series before normalization
     */
    public double denormalize(double normalized, SummaryStats original, PreprocessConfig.NormalizeMethod method) {
        return switch (method) {
            case ZSCORE -> normalized * original.getStdDev() + original.getMean();
            case MINMAX -> normalized * (original.getMax() - original.getMin()) + original.getMin();
        };
    }

    /**
     * Centred simple moving average. Windows are truncated at the series
     * edges.
     */
    public List<DataPoint> smooth(List<DataPoint> data, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        if (data.size() < windowSize) {
            return data;
        }
        int half = windowSize / 2;
        List<DataPoint> out = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(data.size(), i + half + 1);
            double sum = 0;
            for (int j = start; j < end; j++) {
                sum += data.get(j).getValue();
            }
            out.add(data.get(i).withValue(sum / (end - start)));
        }
        return out;
    }

    /**
     * Fit a least-squares line against the point index.
     *
     * <p>
     * A trend is reported when R² exceeds 0.3 and the absolute slope exceeds
     * 0.01.
     * </p>
     */
    public TrendInfo detectTrend(List<DataPoint> data) {
        int n = data.size();
        if (n < 3) {
            return TrendInfo.NONE;
        }
        double xMean = (n - 1) / 2.0;
        double yMean = Statistics.mean(values(data));
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            numerator += dx * (data.get(i).getValue() - yMean);
            denominator += dx * dx;
        }
        double slope = Statistics.safeDivide(numerator, denominator);

        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < n; i++) {
            double y = data.get(i).getValue();
            double predicted = yMean + slope * (i - xMean);
            ssRes += (y - predicted) * (y - predicted);
            ssTot += (y - yMean) * (y - yMean);
        }
        double rSquared = ssTot == 0 ? 0 : 1 - ssRes / ssTot;

        boolean hasTrend = rSquared > TREND_MIN_R_SQUARED && Math.abs(slope) > TREND_MIN_SLOPE;
        TrendInfo.Direction direction;
        if (Math.abs(slope) < TREND_MIN_SLOPE) {
            direction = TrendInfo.Direction.FLAT;
        } else {
            direction = slope > 0 ? TrendInfo.Direction.UP : TrendInfo.Direction.DOWN;
        }
        return new TrendInfo(hasTrend, slope, rSquared, direction);
    }

    /**
     * Subtract the fitted linear trend, pivoting on the series midpoint.
     */
    public List<DataPoint> detrend(List<DataPoint> data) {
        double slope = detectTrend(data).getSlope();
        double xMean = (data.size() - 1) / 2.0;
        List<DataPoint> out = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            DataPoint p = data.get(i);
            out.add(p.withValue(p.getValue() - slope * (i - xMean)));
        }
        return out;
    }

    /**
     * Bucket points into fixed, epoch-aligned intervals.
     *
     * @param intervalMs bucket width in milliseconds
     * @return one point per non-empty bucket, stamped with the bucket start
     */
    public List<DataPoint> aggregate(List<DataPoint> data, long intervalMs, AggregateMethod method) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0, got: " + intervalMs);
        }
        Map<Long, List<Double>> buckets = new TreeMap<>();
        for (DataPoint p : data) {
            long key = Math.floorDiv(p.getTimestamp(), intervalMs) * intervalMs;
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(p.getValue());
        }
        List<DataPoint> out = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, List<Double>> e : buckets.entrySet()) {
            double[] v = Statistics.toArray(e.getValue());
            double reduced = switch (method) {
                case MEAN -> Statistics.mean(v);
                case SUM -> Arrays.stream(v).sum();
                case MAX -> Arrays.stream(v).max().orElse(0);
                case MIN -> Arrays.stream(v).min().orElse(0);
                case LAST -> v[v.length - 1];
            };
            out.add(DataPoint.of(e.getKey(), reduced));
        }
        return out;
    }

    static double[] values(List<DataPoint> data) {
        double[] out = new double[data.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = data.get(i).getValue();
        }
        return out;
    }
}
