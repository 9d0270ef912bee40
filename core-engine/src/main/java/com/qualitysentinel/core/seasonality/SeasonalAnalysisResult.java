package com.qualitysentinel.core.seasonality;

import java.util.List;
import java.util.Optional;

/**
 * Patterns found by {@link SeasonalityAnalyzer#analyze}.
 *
 * @since 1.0.0
 */
public final class SeasonalAnalysisResult {

    static final SeasonalAnalysisResult NONE = new SeasonalAnalysisResult(List.of(), 0, null);

    private final List<SeasonalPattern> patterns;
    private final double confidence;
    private final SeasonalPeriod dominantPeriod;

    SeasonalAnalysisResult(List<SeasonalPattern> patterns, double confidence, SeasonalPeriod dominantPeriod) {
        this.patterns = List.copyOf(patterns);
        this.confidence = confidence;
        this.dominantPeriod = dominantPeriod;
    }

    public boolean hasSeasonality() {
        return !patterns.isEmpty();
    }

    public List<SeasonalPattern> getPatterns() {
        return patterns;
    }

    /** @return strength of the dominant pattern, {@code 0} when none */
    public double getConfidence() {
        return confidence;
    }

    public Optional<SeasonalPeriod> getDominantPeriod() {
        return Optional.ofNullable(dominantPeriod);
    }

    /** @return an enabled config carrying the detected patterns, or a disabled one */
    public SeasonalityConfig toConfig() {
        return hasSeasonality() ? SeasonalityConfig.of(patterns) : SeasonalityConfig.disabled();
    }
}
