package com.qualitysentinel.flink;

import com.qualitysentinel.core.model.DataPoint;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, oldest-first window of recent values for one metric, kept in Flink
 * keyed state.
 *
 * <p>
 * Appending beyond the capacity evicts the oldest point, and points past the
 * detection window can be dropped with {@link #evictBefore(long)}. The history also
 * counts samples since the last baseline refit so the process function knows
 * when to rebuild.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricHistory implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int capacity;
    private final ArrayDeque<DataPoint> points;
    private int samplesSinceRebuild;

    public MetricHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.points = new ArrayDeque<>(capacity);
    }

    public void append(DataPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        if (points.size() == capacity) {
            points.removeFirst();
        }
        points.addLast(point);
        samplesSinceRebuild++;
    }

    /**
     * Drop points older than {@code cutoffMillis}.
     *
     * @return number of points dropped
     */
    public int evictBefore(long cutoffMillis) {
        int dropped = 0;
        while (!points.isEmpty() && points.peekFirst().getTimestamp() < cutoffMillis) {
            points.removeFirst();
            dropped++;
        }
        return dropped;
    }

    /** @return the stored values, oldest first */
    public double[] values() {
        double[] values = new double[points.size()];
        Iterator<DataPoint> it = points.iterator();
        for (int i = 0; i < values.length; i++) {
            values[i] = it.next().getValue();
        }
        return values;
    }

    public List<DataPoint> points() {
        return new ArrayList<>(points);
    }

    public boolean isRebuildDue(int interval) {
        return samplesSinceRebuild >= interval;
    }

    public void markRebuilt() {
        samplesSinceRebuild = 0;
    }

    public int size() {
        return points.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public int getSamplesSinceRebuild() {
        return samplesSinceRebuild;
    }

    @Override
    public String toString() {
        return "MetricHistory{size=" + points.size() + ", capacity=" + capacity
                + ", samplesSinceRebuild=" + samplesSinceRebuild + '}';
    }
}
