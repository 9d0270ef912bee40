package com.qualitysentinel.core.seasonality;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Multiplicative adjustment per calendar bucket for one {@link SeasonalPeriod}.
 *
 * <p>
 * An adjustment of {@code 1.2} means values in that bucket run 20% above the
 * overall mean. Buckets without an entry adjust by {@code 1}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalPattern implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SeasonalPeriod period;
    private final Map<String, Double> adjustments;

    public SeasonalPattern(SeasonalPeriod period, Map<String, Double> adjustments) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(adjustments, "adjustments must not be null");
        this.adjustments = Collections.unmodifiableMap(new LinkedHashMap<>(adjustments));
    }

    public SeasonalPeriod getPeriod() {
        return period;
    }

    public Map<String, Double> getAdjustments() {
        return adjustments;
    }

    /**
     * @param bucketKey bucket produced by {@link SeasonalPeriod#bucketOf}
     * @return stored adjustment, or {@code 1} if the bucket is unknown
     */
    public double adjustmentFor(String bucketKey) {
        Double v = adjustments.get(bucketKey);
        return v != null ? v : 1.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalPattern that))
            return false;
        return period == that.period && adjustments.equals(that.adjustments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, adjustments);
    }

    @Override
    public String toString() {
        return "SeasonalPattern{period=" + period + ", adjustments=" + adjustments + '}';
    }
}
