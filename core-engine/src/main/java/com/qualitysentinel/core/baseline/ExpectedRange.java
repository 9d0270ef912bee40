package com.qualitysentinel.core.baseline;

/**
 * Band of values considered normal at a specific timestamp.
 *
 * @since 1.0.0
 */
public final class ExpectedRange {

    private final double lower;
    private final double upper;

    public ExpectedRange(double lower, double upper) {
        this.lower = lower;
        this.upper = upper;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    @Override
    public String toString() {
        return "ExpectedRange[" + lower + ", " + upper + ']';
    }
}
