package com.qualitysentinel.core.stats;

/**
 * Least-squares trend of a series against its index.
 *
 * @since 1.0.0
 */
public final class TrendInfo {

    public enum Direction {
        UP, DOWN, FLAT
    }

    static final TrendInfo NONE = new TrendInfo(false, 0, 0, Direction.FLAT);

    private final boolean hasTrend;
    private final double slope;
    private final double rSquared;
    private final Direction direction;

    TrendInfo(boolean hasTrend, double slope, double rSquared, Direction direction) {
        this.hasTrend = hasTrend;
        this.slope = slope;
        this.rSquared = rSquared;
        this.direction = direction;
    }

    public boolean hasTrend() {
        return hasTrend;
    }

    public double getSlope() {
        return slope;
    }

    public double getRSquared() {
        return rSquared;
    }

    public Direction getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return "TrendInfo{hasTrend=" + hasTrend + ", slope=" + slope + ", rSquared=" + rSquared
                + ", direction=" + direction + '}';
    }
}
