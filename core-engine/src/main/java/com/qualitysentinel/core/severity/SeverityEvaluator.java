package com.qualitysentinel.core.severity;

import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.model.SeverityFactor;
import com.qualitysentinel.core.model.SeverityResult;
import com.qualitysentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Weighted-factor severity model.
 *
 * <h3>Scoring</h3>
 * <p>
 * Each present factor is mapped to {@code [0, 1]} and multiplied by its
 * weight × 100:
 * </p>
 * <ul>
 * <li><b>deviation</b>: |σ| piecewise, &lt;2 → 0-0.5, 2-3 → 0.5-0.75,
 * 3-4 → 0.75-0.9, above 4 → 0.9-1.0</li>
 * <li><b>duration</b>: hours piecewise, saturating above 24 h</li>
 * <li><b>frequency</b>: {@code sqrt(frequency)}</li>
 * <li><b>impact</b>: affected ratio piecewise with knees at 5%, 20%, 50%</li>
 * </ul>
 * <p>
 * A regression adds a flat penalty and a failure streak longer than one adds
 * up to {@code log10(n)} × bonus. The sum is multiplied by the anomaly type's
 * multiplier and clamped to {@code [0, 100]}, then bucketed:
 * {@code ≥80 critical, ≥60 high, ≥40 medium, else low}.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class SeverityEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SeverityEvaluator.class);

    static final String DEVIATION = "deviation";
    static final String DURATION = "duration";
    static final String FREQUENCY = "frequency";
    static final String IMPACT = "impact";
    static final String REGRESSION = "regression";
    static final String CONSECUTIVE = "consecutive";
    static final String TYPE_MODIFIER = "type_modifier";
    private static final String DEFAULT = "default";

    /** σ thresholds used by {@link #severityFromDeviation}. */
    static final double CRITICAL_SIGMA = 4;
    static final double HIGH_SIGMA = 3;
    static final double MEDIUM_SIGMA = 2;

    private static final Map<Severity, Map<String, String>> RECOMMENDATIONS = recommendations();

    private final SeverityWeights weights;

    public SeverityEvaluator() {
        this(SeverityWeights.defaults());
    }

    public SeverityEvaluator(SeverityWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    public SeverityWeights getWeights() {
        return weights;
    }

    // -------------------------------------------------------------------------
    // Scoring
    // -------------------------------------------------------------------------

    /**
     * Score an anomaly candidate.
     *
     * @param input factors to score; must not be {@code null}
     * @return severity, score, the contributing factors and a recommendation
     */
    public SeverityResult evaluate(SeverityInput input) {
        Objects.requireNonNull(input, "input must not be null");
        List<SeverityFactor> factors = factors(input);
        double score = score(factors);
        Severity severity = toSeverity(score);
        String recommendation = recommend(severity, factors);
        LOG.debug("Scored {} -> {} ({})", input, severity, score);
        return new SeverityResult(severity, score, factors, recommendation);
    }

    List<SeverityFactor> factors(SeverityInput input) {
        List<SeverityFactor> factors = new ArrayList<>();

        double dev = Math.abs(input.getDeviation());
        factors.add(new SeverityFactor(DEVIATION, weights.getDeviation(), dev,
                deviationFactor(dev) * weights.getDeviation() * 100));

        input.getDuration().ifPresent(d -> factors.add(new SeverityFactor(DURATION, weights.getDuration(),
                d.toMillis(), durationFactor(d.toMillis() / 3_600_000.0) * weights.getDuration() * 100)));

        input.getHistoricalFrequency().ifPresent(f -> factors.add(new SeverityFactor(FREQUENCY,
                weights.getFrequency(), f, Math.sqrt(f) * weights.getFrequency() * 100)));

        input.getAffectedRatio().ifPresent(r -> factors.add(new SeverityFactor(IMPACT, weights.getImpact(), r,
                impactFactor(r) * weights.getImpact() * 100)));

        if (input.isRegression()) {
            factors.add(new SeverityFactor(REGRESSION, weights.getRegressionPenalty() / 100, 1,
                    weights.getRegressionPenalty()));
        }

        int streak = input.getConsecutiveFailures().orElse(0);
        if (streak > 1) {
            factors.add(new SeverityFactor(CONSECUTIVE, weights.getConsecutiveBonus() / 100, streak,
                    consecutiveFactor(streak) * weights.getConsecutiveBonus()));
        }

        double multiplier = weights.typeMultiplier(input.getType());
        if (multiplier != 1.0) {
            factors.add(new SeverityFactor(TYPE_MODIFIER, 0, multiplier, 0));
        }
        return factors;
    }

    static double deviationFactor(double absDeviation) {
        if (absDeviation < 2) {
            return absDeviation / 4;
        }
        if (absDeviation < 3) {
            return 0.5 + (absDeviation - 2) * 0.25;
        }
        if (absDeviation < 4) {
            return 0.75 + (absDeviation - 3) * 0.15;
        }
        return Math.min(1, 0.9 + (absDeviation - 4) * 0.025);
    }

    static double durationFactor(double hours) {
        if (hours < 1) {
            return hours * 0.25;
        }
        if (hours < 4) {
            return 0.25 + (hours - 1) * 0.167;
        }
        if (hours < 24) {
            return 0.75 + (hours - 4) * 0.0125;
        }
        return Math.min(1, 0.95 + (hours - 24) * 0.001);
    }

    static double impactFactor(double ratio) {
        if (ratio < 0.05) {
            return ratio * 5;
        }
        if (ratio < 0.2) {
            return 0.25 + (ratio - 0.05) * 3.33;
        }
        if (ratio < 0.5) {
            return 0.75 + (ratio - 0.2) * 0.67;
        }
        return Math.min(1, 0.95 + (ratio - 0.5) * 0.1);
    }

    static double consecutiveFactor(int streak) {
        return Math.min(1, Math.log10(streak));
    }

    private static double score(List<SeverityFactor> factors) {
        double sum = 0;
        double multiplier = 1;
        for (SeverityFactor f : factors) {
            if (TYPE_MODIFIER.equals(f.getName())) {
                multiplier = f.getValue();
            } else {
                sum += f.getContribution();
            }
        }
        return Statistics.clamp(sum * multiplier, 0, 100);
    }

    static Severity toSeverity(double score) {
        if (score >= 80) {
            return Severity.CRITICAL;
        }
        if (score >= 60) {
            return Severity.HIGH;
        }
        if (score >= 40) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private static String recommend(Severity severity, List<SeverityFactor> factors) {
        String primary = factors.stream()
                .filter(f -> f.getContribution() > 0)
                .max(Comparator.comparingDouble(SeverityFactor::getContribution))
                .map(SeverityFactor::getName)
                .orElse(DEVIATION);
        Map<String, String> table = RECOMMENDATIONS.get(severity);
        return table.getOrDefault(primary, table.get(DEFAULT));
    }

    // -------------------------------------------------------------------------
    // Impact and priority
    // -------------------------------------------------------------------------

    /**
     * Assess scope and urgency. Urgency is {@code IMMEDIATE} only for a
     * regression with critical scope.
     */
    public ImpactAssessment assessImpact(SeverityInput input) {
        Objects.requireNonNull(input, "input must not be null");
        double pct = input.getAffectedRatio().orElse(0) * 100;

        ImpactAssessment.Scope scope;
        if (pct >= 50) {
            scope = ImpactAssessment.Scope.CRITICAL;
        } else if (pct >= 20) {
            scope = ImpactAssessment.Scope.HIGH;
        } else if (pct >= 5) {
            scope = ImpactAssessment.Scope.MEDIUM;
        } else {
            scope = ImpactAssessment.Scope.LOW;
        }

        ImpactAssessment.Urgency urgency;
        if (input.isRegression() && scope == ImpactAssessment.Scope.CRITICAL) {
            urgency = ImpactAssessment.Urgency.IMMEDIATE;
        } else if (scope == ImpactAssessment.Scope.CRITICAL || input.getConsecutiveFailures().orElse(0) >= 5) {
            urgency = ImpactAssessment.Urgency.HIGH;
        } else if (scope == ImpactAssessment.Scope.HIGH || input.isRegression()) {
            urgency = ImpactAssessment.Urgency.MEDIUM;
        } else {
            urgency = ImpactAssessment.Urgency.LOW;
        }

        String text = String.format(Locale.ROOT, "%s %s across %.1f%% of test cases",
                scopeText(scope), subjectOf(input.getType()), pct);
        return new ImpactAssessment(scope, pct, text, urgency);
    }

    /**
     * Sortable queue priority: severity base (25/50/75/100), +10 for a
     * regression, + affected ratio × 20, − historical frequency × 5.
     */
    public double calculatePriority(Severity severity, SeverityInput input) {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(input, "input must not be null");
        double base = severity.getWeight() * 25.0;
        double regressionBoost = input.isRegression() ? 10 : 0;
        double impactBoost = input.getAffectedRatio().orElse(0) * 20;
        double frequencyPenalty = input.getHistoricalFrequency().orElse(0) * 5;
        return base + regressionBoost + impactBoost - frequencyPenalty;
    }

    /**
     * Evaluate every input and order the results by descending priority.
     */
    public List<PrioritizedSeverity> evaluateAndPrioritize(List<SeverityInput> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        List<PrioritizedSeverity> out = new ArrayList<>(inputs.size());
        for (SeverityInput input : inputs) {
            SeverityResult result = evaluate(input);
            out.add(new PrioritizedSeverity(input, result, calculatePriority(result.getSeverity(), input)));
        }
        out.sort(Comparator.comparingDouble(PrioritizedSeverity::getPriority).reversed());
        return out;
    }

    /** @return negative, zero or positive as {@code a} ranks below, equal to or above {@code b} */
    public int compareSeverity(Severity a, Severity b) {
        return a.compareTo(b);
    }

    /**
     * Severity of a raw deviation from the baseline mean, measured in the
     * baseline's standard deviations (raw units when stdDev is zero).
     */
    public Severity severityFromDeviation(double deviation, Baseline baseline) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        double abs = Math.abs(deviation);
        double sigmas = baseline.getStdDev() != 0 ? abs / baseline.getStdDev() : abs;
        if (sigmas >= CRITICAL_SIGMA) {
            return Severity.CRITICAL;
        }
        if (sigmas >= HIGH_SIGMA) {
            return Severity.HIGH;
        }
        if (sigmas >= MEDIUM_SIGMA) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    // -------------------------------------------------------------------------
    // Text tables
    // -------------------------------------------------------------------------

    private static String scopeText(ImpactAssessment.Scope scope) {
        return switch (scope) {
            case CRITICAL -> "severely impacting";
            case HIGH -> "significantly affecting";
            case MEDIUM -> "moderately affecting";
            case LOW -> "minimally affecting";
        };
    }

    private static String subjectOf(AnomalyType type) {
        return switch (type) {
            case DURATION_SPIKE -> "test execution time";
            case FAILURE_SPIKE, CONSECUTIVE_FAILURES -> "test reliability";
            case FLAKY_PATTERN, FLAKY_DETECTED -> "test determinism";
            case PERFORMANCE_DEGRADATION -> "system performance";
            case SUCCESS_RATE_DROP, PASS_RATE_DROP -> "overall test quality";
            case RESOURCE_ANOMALY -> "resource utilization";
            case TREND_CHANGE -> "quality trajectory";
            case SEASONAL_DEVIATION -> "expected patterns";
        };
    }

    private static Map<Severity, Map<String, String>> recommendations() {
        Map<Severity, Map<String, String>> m = new EnumMap<>(Severity.class);
        m.put(Severity.CRITICAL, Map.of(
                DEVIATION, "Immediate investigation required. Value significantly outside normal range.",
                DURATION, "Long-standing critical issue. Escalate to team lead immediately.",
                FREQUENCY, "Recurring critical issue. Root cause analysis mandatory.",
                IMPACT, "Wide-spread impact. Consider rollback or hotfix.",
                REGRESSION, "Critical regression detected. Block deployments until resolved.",
                CONSECUTIVE, "Extended failure sequence. Check for systemic issues.",
                DEFAULT, "Critical anomaly detected. Immediate action required."));
        m.put(Severity.HIGH, Map.of(
                DEVIATION, "Significant deviation from baseline. Investigate within 24 hours.",
                DURATION, "Issue persisting for extended period. Schedule investigation.",
                FREQUENCY, "Frequently occurring issue. Add to sprint backlog.",
                IMPACT, "Affecting significant portion of tests. Prioritize investigation.",
                REGRESSION, "Regression detected. Review recent changes.",
                CONSECUTIVE, "Multiple consecutive failures. Check test stability.",
                DEFAULT, "High severity anomaly. Plan investigation soon."));
        m.put(Severity.MEDIUM, Map.of(
                DEVIATION, "Notable deviation. Monitor for further changes.",
                DURATION, "Issue ongoing. Review if time permits.",
                FREQUENCY, "Occasional issue. Consider adding to backlog.",
                IMPACT, "Moderate impact. Investigate when convenient.",
                REGRESSION, "Minor regression. Review when time permits.",
                CONSECUTIVE, "Some consecutive failures. Watch for patterns.",
                DEFAULT, "Medium severity anomaly. Monitor and review."));
        m.put(Severity.LOW, Map.of(
                DEVIATION, "Minor deviation within acceptable range. No action needed.",
                DURATION, "Short-lived variation. Continue monitoring.",
                FREQUENCY, "Rare occurrence. No immediate action needed.",
                IMPACT, "Limited impact. Monitor passively.",
                REGRESSION, "Minimal regression. Continue monitoring.",
                CONSECUTIVE, "Isolated failures. Normal variation.",
                DEFAULT, "Low severity anomaly. Continue normal monitoring."));
        return m;
    }
}
