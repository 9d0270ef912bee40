package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.algorithms.Iqr;

/**
 * Tukey-fence test over the raw history; needs at least
 * {@value #MIN_HISTORY} points.
 *
 * @since 1.0.0
 */
public class IqrDetector implements AnomalyDetector {

    static final int MIN_HISTORY = 4;

    private final double multiplier;

    public IqrDetector() {
        this(Iqr.DEFAULT_MULTIPLIER);
    }

    /**
     * @param multiplier fence distance {@code k} in IQR units
     * @throws IllegalArgumentException if {@code multiplier <= 0}
     */
    public IqrDetector(double multiplier) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.IQR;
    }

    @Override
    public boolean canRun(DetectionContext context) {
        return context.getHistorySize() >= MIN_HISTORY;
    }

    @Override
    public Verdict detect(double value, DetectionContext context) {
        Iqr.Result r = Iqr.detect(value, context.getHistory(), multiplier);
        return new Verdict(Algorithm.IQR, r.isAnomaly(), r.getDeviation(), r.getStats().getQ2());
    }

    public double getMultiplier() {
        return multiplier;
    }
}
