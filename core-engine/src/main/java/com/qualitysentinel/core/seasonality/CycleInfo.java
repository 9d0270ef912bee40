package com.qualitysentinel.core.seasonality;

/**
 * Dominant cycle estimated from autocorrelation peaks.
 *
 * @since 1.0.0
 */
public final class CycleInfo {

    private final double periodMs;
    private final double strength;
    private final SeasonalPeriod type;

    CycleInfo(double periodMs, double strength, SeasonalPeriod type) {
        this.periodMs = periodMs;
        this.strength = strength;
        this.type = type;
    }

    public double getPeriodMs() {
        return periodMs;
    }

    /** @return autocorrelation at the peak lag */
    public double getStrength() {
        return strength;
    }

    public SeasonalPeriod getType() {
        return type;
    }

    @Override
    public String toString() {
        return "CycleInfo{periodMs=" + periodMs + ", strength=" + strength + ", type=" + type + '}';
    }
}
