package com.qualitysentinel.core.stats;

import java.util.Objects;

/**
 * Options for {@link DataPreprocessor#preprocess}.
 *
 * <p>
 * Defaults: outlier removal at 3σ, linear gap filling, no normalization,
 * zeros kept.
 * </p>
 *
 * @since 1.0.0
 */
public final class PreprocessConfig {

    /** How synthetic points inside a gap get their value. */
    public enum FillMethod {
        LINEAR, PREVIOUS, MEAN
    }

    public enum NormalizeMethod {
        ZSCORE, MINMAX
    }

    private static final PreprocessConfig DEFAULTS = builder().build();

    private final boolean outlierRemoval;
    private final double outlierThreshold;
    private final boolean fillMissing;
    private final FillMethod fillMethod;
    private final boolean normalize;
    private final NormalizeMethod normalizeMethod;
    private final boolean removeZeros;

    private PreprocessConfig(Builder b) {
        this.outlierRemoval = b.outlierRemoval;
        this.outlierThreshold = b.outlierThreshold;
        this.fillMissing = b.fillMissing;
        this.fillMethod = b.fillMethod;
        this.normalize = b.normalize;
        this.normalizeMethod = b.normalizeMethod;
        this.removeZeros = b.removeZeros;
    }

    public static PreprocessConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isOutlierRemoval() {
        return outlierRemoval;
    }

    public double getOutlierThreshold() {
        return outlierThreshold;
    }

    public boolean isFillMissing() {
        return fillMissing;
    }

    public FillMethod getFillMethod() {
        return fillMethod;
    }

    public boolean isNormalize() {
        return normalize;
    }

    public NormalizeMethod getNormalizeMethod() {
        return normalizeMethod;
    }

    public boolean isRemoveZeros() {
        return removeZeros;
    }

    public static class Builder {
        private boolean outlierRemoval = true;
        private double outlierThreshold = 3.0;
        private boolean fillMissing = true;
        private FillMethod fillMethod = FillMethod.LINEAR;
        private boolean normalize;
        private NormalizeMethod normalizeMethod = NormalizeMethod.ZSCORE;
        private boolean removeZeros;

        public Builder outlierRemoval(boolean v) {
            this.outlierRemoval = v;
            return this;
        }

        public Builder outlierThreshold(double v) {
            this.outlierThreshold = v;
            return this;
        }

        public Builder fillMissing(boolean v) {
            this.fillMissing = v;
            return this;
        }

        public Builder fillMethod(FillMethod v) {
            this.fillMethod = v;
            return this;
        }

        public Builder normalize(boolean v) {
            this.normalize = v;
            return this;
        }

        public Builder normalizeMethod(NormalizeMethod v) {
            this.normalizeMethod = v;
            return this;
        }

        public Builder removeZeros(boolean v) {
            this.removeZeros = v;
            return this;
        }

        public PreprocessConfig build() {
            Objects.requireNonNull(fillMethod, "fillMethod must not be null");
            Objects.requireNonNull(normalizeMethod, "normalizeMethod must not be null");
            if (outlierThreshold <= 0) {
                throw new IllegalArgumentException("outlierThreshold must be > 0, got: " + outlierThreshold);
            }
            return new PreprocessConfig(this);
        }
    }
}
