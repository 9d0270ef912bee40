package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.detection.Algorithm;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings for one detection call.
 *
 * <p>
 * Defaults: enabled, all four algorithms, {@link Sensitivity#MEDIUM},
 * default thresholds, at least 10 historical points when no baseline exists,
 * a 30-day detection window.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig {

    public static final int DEFAULT_MIN_DATA_POINTS = 10;
    public static final int DEFAULT_WINDOW_DAYS = 30;

    private static final DetectionConfig DEFAULTS = builder().build();

    private final boolean enabled;
    private final Set<Algorithm> algorithms;
    private final Sensitivity sensitivity;
    private final DetectionThresholds thresholds;
    private final int minDataPoints;
    private final int detectionWindowDays;

    private DetectionConfig(Builder b) {
        this.enabled = b.enabled;
        this.algorithms = Collections.unmodifiableSet(EnumSet.copyOf(b.algorithms));
        this.sensitivity = b.sensitivity;
        this.thresholds = b.thresholds;
        this.minDataPoints = b.minDataPoints;
        this.detectionWindowDays = b.detectionWindowDays;
    }

    public static DetectionConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .algorithms(algorithms)
                .sensitivity(sensitivity)
                .thresholds(thresholds)
                .minDataPoints(minDataPoints)
                .detectionWindowDays(detectionWindowDays);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** @return unmodifiable set, iterated in precedence order */
    public Set<Algorithm> getAlgorithms() {
        return algorithms;
    }

    public Sensitivity getSensitivity() {
        return sensitivity;
    }

    /** @return the explicit z-score threshold if set, else the one implied by the sensitivity */
    public double getThreshold() {
        return thresholds.getZScore().orElse(sensitivity.getThreshold());
    }

    public DetectionThresholds getThresholds() {
        return thresholds;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public int getDetectionWindowDays() {
        return detectionWindowDays;
    }

    @Override
    public String toString() {
        return "DetectionConfig{enabled=" + enabled + ", algorithms=" + algorithms
                + ", sensitivity=" + sensitivity + ", minDataPoints=" + minDataPoints + '}';
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static class Builder {

        private boolean enabled = true;
        private Set<Algorithm> algorithms = EnumSet.allOf(Algorithm.class);
        private Sensitivity sensitivity = Sensitivity.MEDIUM;
        private DetectionThresholds thresholds = DetectionThresholds.defaults();
        private int minDataPoints = DEFAULT_MIN_DATA_POINTS;
        private int detectionWindowDays = DEFAULT_WINDOW_DAYS;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder algorithms(Set<Algorithm> algorithms) {
            Objects.requireNonNull(algorithms, "algorithms must not be null");
            this.algorithms = algorithms.isEmpty() ? EnumSet.noneOf(Algorithm.class) : EnumSet.copyOf(algorithms);
            return this;
        }

        public Builder algorithms(Algorithm first, Algorithm... rest) {
            this.algorithms = EnumSet.of(first, rest);
            return this;
        }

        public Builder sensitivity(Sensitivity sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public Builder thresholds(DetectionThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder minDataPoints(int minDataPoints) {
            this.minDataPoints = minDataPoints;
            return this;
        }

        public Builder detectionWindowDays(int detectionWindowDays) {
            this.detectionWindowDays = detectionWindowDays;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range or an
         *                                  enabled config has no algorithms
         */
        public DetectionConfig build() {
            Objects.requireNonNull(sensitivity, "sensitivity must not be null");
            Objects.requireNonNull(thresholds, "thresholds must not be null");
            if (enabled && algorithms.isEmpty()) {
                throw new IllegalArgumentException("at least one algorithm must be enabled");
            }
            if (minDataPoints < 1) {
                throw new IllegalArgumentException("minDataPoints must be >= 1, got: " + minDataPoints);
            }
            if (detectionWindowDays < 1) {
                throw new IllegalArgumentException(
                        "detectionWindowDays must be >= 1, got: " + detectionWindowDays);
            }
            return new DetectionConfig(this);
        }
    }
}
