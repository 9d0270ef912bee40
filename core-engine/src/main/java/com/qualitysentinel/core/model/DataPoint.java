package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable (timestamp, value) observation of a scalar metric.
 *
 * @since 1.0.0
 */
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Epoch milliseconds. */
    private final long timestamp;
    private final double value;

    public DataPoint(long timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public static DataPoint of(long timestamp, double value) {
        return new DataPoint(timestamp, value);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @param newValue replacement value
     * @return a point at the same timestamp carrying {@code newValue}
     */
    public DataPoint withValue(double newValue) {
        return new DataPoint(timestamp, newValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return timestamp == that.timestamp && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "DataPoint{timestamp=" + timestamp + ", value=" + value + '}';
    }
}
