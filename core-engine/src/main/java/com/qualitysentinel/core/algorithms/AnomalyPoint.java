package com.qualitysentinel.core.algorithms;

/**
 * One flagged element of a series scan.
 *
 * @since 1.0.0
 */
public final class AnomalyPoint {

    private final int index;
    private final double value;
    private final double deviation;
    private final long timestamp;

    public AnomalyPoint(int index, double value, double deviation, long timestamp) {
        this.index = index;
        this.value = value;
        this.deviation = deviation;
        this.timestamp = timestamp;
    }

    public int getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    /** @return signed deviation in the scanning algorithm's units */
    public double getDeviation() {
        return deviation;
    }

    /** @return epoch millis, or {@code 0} when the series carried no timestamps */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "AnomalyPoint{index=" + index + ", value=" + value + ", deviation=" + deviation + '}';
    }
}
