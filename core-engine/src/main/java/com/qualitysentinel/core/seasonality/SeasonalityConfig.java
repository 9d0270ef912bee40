package com.qualitysentinel.core.seasonality;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Whether seasonal adjustment is applied, and with which patterns.
 *
 * @since 1.0.0
 */
public final class SeasonalityConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final SeasonalityConfig DISABLED = new SeasonalityConfig(false, List.of());

    private final boolean enabled;
    private final List<SeasonalPattern> patterns;

    public SeasonalityConfig(boolean enabled, List<SeasonalPattern> patterns) {
        this.enabled = enabled;
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns must not be null"));
    }

    public static SeasonalityConfig disabled() {
        return DISABLED;
    }

    public static SeasonalityConfig of(List<SeasonalPattern> patterns) {
        return new SeasonalityConfig(true, patterns);
    }

    /** @return {@code true} if enabled with at least one pattern */
    public boolean isActive() {
        return enabled && !patterns.isEmpty();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<SeasonalPattern> getPatterns() {
        return patterns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalityConfig that))
            return false;
        return enabled == that.enabled && patterns.equals(that.patterns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, patterns);
    }

    @Override
    public String toString() {
        return "SeasonalityConfig{enabled=" + enabled + ", patterns=" + patterns + '}';
    }
}
