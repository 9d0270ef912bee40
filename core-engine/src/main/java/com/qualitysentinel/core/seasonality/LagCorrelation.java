package com.qualitysentinel.core.seasonality;

/**
 * Autocorrelation of a series at one lag.
 *
 * @since 1.0.0
 */
public final class LagCorrelation {

    private final int lag;
    private final double correlation;

    LagCorrelation(int lag, double correlation) {
        this.lag = lag;
        this.correlation = correlation;
    }

    public int getLag() {
        return lag;
    }

    public double getCorrelation() {
        return correlation;
    }

    @Override
    public String toString() {
        return "LagCorrelation{lag=" + lag + ", correlation=" + correlation + '}';
    }
}
