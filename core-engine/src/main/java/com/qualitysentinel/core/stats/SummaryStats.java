package com.qualitysentinel.core.stats;

/**
 * Moment and order statistics of a sample.
 *
 * <p>
 * {@code stdDev} is the population standard deviation. Quartiles are taken at
 * index {@code floor(n * p)} of the sorted sample, without interpolation.
 * </p>
 *
 * @since 1.0.0
 */
public final class SummaryStats {

    static final SummaryStats EMPTY = new SummaryStats(0, 0, 0, 0, 0, 0, 0, 0);

    private final int count;
    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;
    private final double median;
    private final double q1;
    private final double q3;

    SummaryStats(int count, double mean, double stdDev, double min, double max,
            double median, double q1, double q3) {
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
        this.median = median;
        this.q1 = q1;
        this.q3 = q3;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMedian() {
        return median;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public String toString() {
        return "SummaryStats{" +
                "count=" + count +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", min=" + min +
                ", max=" + max +
                ", median=" + median +
                ", q1=" + q1 +
                ", q3=" + q3 +
                '}';
    }
}
