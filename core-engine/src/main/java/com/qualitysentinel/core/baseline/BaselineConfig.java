package com.qualitysentinel.core.baseline;

import com.qualitysentinel.core.seasonality.SeasonalityConfig;

import java.io.Serializable;
import java.util.Objects;

/**
 * How a baseline is fitted for one metric.
 *
 * <p>
 * Defaults: {@link BaselineMethod#MOVING_AVERAGE}, a window of 30 points,
 * outlier exclusion on, seasonality off.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_WINDOW_SIZE = 30;

    private static final BaselineConfig DEFAULTS = builder().build();

    private final BaselineMethod calculationMethod;
    private final int windowSize;
    private final boolean excludeAnomalies;
    private final SeasonalityConfig seasonality;

    private BaselineConfig(Builder b) {
        this.calculationMethod = b.calculationMethod;
        this.windowSize = b.windowSize;
        this.excludeAnomalies = b.excludeAnomalies;
        this.seasonality = b.seasonality;
    }

    public static BaselineConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .calculationMethod(calculationMethod)
                .windowSize(windowSize)
                .excludeAnomalies(excludeAnomalies)
                .seasonality(seasonality);
    }

    public BaselineConfig withSeasonality(SeasonalityConfig newSeasonality) {
        return toBuilder().seasonality(newSeasonality).build();
    }

    public BaselineMethod getCalculationMethod() {
        return calculationMethod;
    }

    /** @return number of trailing points used by the moving-average method; also drives the period label */
    public int getWindowSize() {
        return windowSize;
    }

    /** @return whether 3σ outliers are dropped before fitting */
    public boolean isExcludeAnomalies() {
        return excludeAnomalies;
    }

    public SeasonalityConfig getSeasonality() {
        return seasonality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineConfig that))
            return false;
        return windowSize == that.windowSize
                && excludeAnomalies == that.excludeAnomalies
                && calculationMethod == that.calculationMethod
                && seasonality.equals(that.seasonality);
    }

    @Override
    public int hashCode() {
        return Objects.hash(calculationMethod, windowSize, excludeAnomalies, seasonality);
    }

    @Override
    public String toString() {
        return "BaselineConfig{" +
                "calculationMethod=" + calculationMethod +
                ", windowSize=" + windowSize +
                ", excludeAnomalies=" + excludeAnomalies +
                ", seasonality=" + seasonality +
                '}';
    }

    public static class Builder {
        private BaselineMethod calculationMethod = BaselineMethod.MOVING_AVERAGE;
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private boolean excludeAnomalies = true;
        private SeasonalityConfig seasonality = SeasonalityConfig.disabled();

        public Builder calculationMethod(BaselineMethod v) {
            this.calculationMethod = v;
            return this;
        }

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder excludeAnomalies(boolean v) {
            this.excludeAnomalies = v;
            return this;
        }

        public Builder seasonality(SeasonalityConfig v) {
            this.seasonality = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code windowSize < 1}
         */
        public BaselineConfig build() {
            Objects.requireNonNull(calculationMethod, "calculationMethod must not be null");
            Objects.requireNonNull(seasonality, "seasonality must not be null");
            if (windowSize < 1) {
                throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
            }
            return new BaselineConfig(this);
        }
    }
}
