package com.qualitysentinel.core.algorithms;

/**
 * Moving average with upper and lower bands at {@code ± multiplier·σ}.
 *
 * @since 1.0.0
 */
public final class BollingerBands {

    private final double[] upper;
    private final double[] middle;
    private final double[] lower;

    BollingerBands(double[] upper, double[] middle, double[] lower) {
        this.upper = upper;
        this.middle = middle;
        this.lower = lower;
    }

    public double upper(int i) {
        return upper[i];
    }

    public double middle(int i) {
        return middle[i];
    }

    public double lower(int i) {
        return lower[i];
    }

    public int size() {
        return middle.length;
    }
}
