package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.algorithms.MovingAverage;

/**
 * Trailing simple moving average test.
 *
 * <p>
 * Runs with at least {@value #MIN_HISTORY} historical points over a window of
 * {@code min(windowSize, history)}. The reported deviation is the z-score of
 * {@code value - movingAverage} against the trailing stdDev, so it is in the
 * same σ units as the z-score detectors.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageDetector implements AnomalyDetector {

    static final int MIN_HISTORY = 10;

    private final int windowSize;

    public MovingAverageDetector() {
        this(MovingAverage.DEFAULT_WINDOW);
    }

    public MovingAverageDetector(int windowSize) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.MOVING_AVERAGE;
    }

    @Override
    public boolean canRun(DetectionContext context) {
        return context.getHistorySize() >= MIN_HISTORY;
    }

    @Override
    public Verdict detect(double value, DetectionContext context) {
        double[] history = context.getHistory();
        MovingAverage.Result r = MovingAverage.detect(value, history,
                Math.min(windowSize, history.length), context.getThreshold(), false, MovingAverage.DEFAULT_ALPHA);
        return new Verdict(Algorithm.MOVING_AVERAGE, r.isAnomaly(), r.getZScore(), r.getMovingAverage());
    }

    public int getWindowSize() {
        return windowSize;
    }
}
