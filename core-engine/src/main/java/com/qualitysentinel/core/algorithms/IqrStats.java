package com.qualitysentinel.core.algorithms;

/**
 * Quartiles and Tukey fences of a sample.
 *
 * @since 1.0.0
 */
public final class IqrStats {

    private final double q1;
    private final double q2;
    private final double q3;
    private final double iqr;
    private final double lowerBound;
    private final double upperBound;

    IqrStats(double q1, double q2, double q3, double multiplier) {
        this.q1 = q1;
        this.q2 = q2;
        this.q3 = q3;
        this.iqr = q3 - q1;
        this.lowerBound = q1 - multiplier * iqr;
        this.upperBound = q3 + multiplier * iqr;
    }

    public double getQ1() {
        return q1;
    }

    /** @return median */
    public double getQ2() {
        return q2;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return iqr;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    @Override
    public String toString() {
        return "IqrStats{q1=" + q1 + ", q2=" + q2 + ", q3=" + q3
                + ", bounds=[" + lowerBound + ", " + upperBound + "]}";
    }
}
