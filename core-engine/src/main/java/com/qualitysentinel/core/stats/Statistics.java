package com.qualitysentinel.core.stats;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Pure statistical helpers shared by the preprocessor, baseline builder and
 * detection algorithms.
 *
 * <p>
 * Every division by a zero spread returns {@code 0} rather than
 * {@code NaN} or an infinity.
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    /** Consistency constant relating MAD to the standard deviation of a normal distribution. */
    public static final double MAD_TO_STDDEV = 1.4826;

    /** Scale factor for the modified z-score ({@code 1 / 1.4826}). */
    public static final double MODIFIED_Z_FACTOR = 0.6745;

    private Statistics() {
        // utility class
    }

    /**
     * Summarise a sample.
     *
     * @param values sample; may be empty
     * @return summary, all zeros for an empty sample
     */
    public static SummaryStats summarize(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n == 0) {
            return SummaryStats.EMPTY;
        }
        double[] sorted = sorted(values);
        double mean = mean(values);
        return new SummaryStats(
                n,
                mean,
                stdDev(values, mean),
                sorted[0],
                sorted[n - 1],
                medianOfSorted(sorted),
                sorted[quantileIndex(n, 0.25)],
                sorted[quantileIndex(n, 0.75)]);
    }

    public static SummaryStats summarize(Collection<Double> values) {
        return summarize(toArray(values));
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population standard deviation. */
    public static double stdDev(double[] values) {
        return stdDev(values, mean(values));
    }

    static double stdDev(double[] values, double mean) {
        if (values.length == 0) {
            return 0;
        }
        double sumSquares = 0;
        for (double v : values) {
            double d = v - mean;
            sumSquares += d * d;
        }
        return Math.sqrt(sumSquares / values.length);
    }

    public static double median(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        return medianOfSorted(sorted(values));
    }

    /**
     * Median absolute deviation around the sample median.
     *
     * @param values sample
     * @return MAD, {@code 0} for an empty sample
     */
    public static double mad(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /**
     * Nearest-rank percentile at index {@code floor(n * p)}, clamped to the
     * last element.
     *
     * @param values sample
     * @param p      fraction in {@code [0, 1]}
     * @return the percentile value, {@code 0} for an empty sample
     */
    public static double percentile(double[] values, double p) {
        if (p < 0 || p > 1) {
            throw new IllegalArgumentException("percentile must be within [0, 1], got: " + p);
        }
        if (values.length == 0) {
            return 0;
        }
        double[] sorted = sorted(values);
        return sorted[quantileIndex(sorted.length, p)];
    }

    /**
     * Standard score of {@code value}.
     *
     * @return {@code (value - mean) / stdDev}, or {@code 0} when {@code stdDev}
     *         is zero
     */
    public static double zScore(double value, double mean, double stdDev) {
        return safeDivide(value - mean, stdDev);
    }

    /**
     * @return {@code numerator / denominator}, or {@code 0} when the divisor is
     *         zero or the quotient is not finite
     */
    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0) {
            return 0;
        }
        double result = numerator / denominator;
        return Double.isFinite(result) ? result : 0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double[] toArray(Collection<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        double[] out = new double[values.size()];
        int i = 0;
        for (Double v : values) {
            out[i++] = v;
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Internal helpers
    // ---------------------------------------------------------------

    static double[] sorted(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    static double medianOfSorted(double[] sorted) {
        int n = sorted.length;
        if (n % 2 == 0) {
            return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
        }
        return sorted[n / 2];
    }

    static int quantileIndex(int n, double p) {
        return Math.min(n - 1, (int) Math.floor(n * p));
    }
}
