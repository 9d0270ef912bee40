package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.AnomalyType;

import java.util.Locale;

/**
 * Maps a metric name and deviation direction to an {@link AnomalyType}, and
 * renders the anomaly description.
 *
 * <h3>Keyword rules, first match wins</h3>
 * <ol>
 * <li>{@code duration}, {@code time}: spike above, degradation below</li>
 * <li>{@code failure}, {@code error}: failure spike</li>
 * <li>{@code success}, {@code pass}: rate drop below, trend change above</li>
 * <li>{@code memory}, {@code cpu}, {@code resource}: resource anomaly</li>
 * <li>otherwise by sign, as for durations</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class AnomalyClassifier {

    private AnomalyClassifier() {
        // utility class
    }

    public static AnomalyType classify(String metricName, double deviation) {
        String name = metricName.toLowerCase(Locale.ROOT);
        if (name.contains("duration") || name.contains("time")) {
            return bySign(deviation);
        }
        if (name.contains("failure") || name.contains("error")) {
            return AnomalyType.FAILURE_SPIKE;
        }
        if (name.contains("success") || name.contains("pass")) {
            return deviation < 0 ? AnomalyType.SUCCESS_RATE_DROP : AnomalyType.TREND_CHANGE;
        }
        if (name.contains("memory") || name.contains("cpu") || name.contains("resource")) {
            return AnomalyType.RESOURCE_ANOMALY;
        }
        return bySign(deviation);
    }

    private static AnomalyType bySign(double deviation) {
        return deviation > 0 ? AnomalyType.DURATION_SPIKE : AnomalyType.PERFORMANCE_DEGRADATION;
    }

    /**
     * One-line human description, e.g.
     * {@code "Test execution time 4.2σ above baseline"}.
     */
    public static String describe(AnomalyType type, double deviation, String metricName) {
        String sigma = String.format(Locale.ROOT, "%.1fσ", Math.abs(deviation));
        String direction = deviation > 0 ? "above" : "below";
        return switch (type) {
            case DURATION_SPIKE -> "Test execution time " + sigma + " " + direction + " baseline";
            case FAILURE_SPIKE -> "Failure rate " + sigma + " " + direction + " normal";
            case FLAKY_PATTERN, FLAKY_DETECTED -> "Inconsistent test results detected";
            case PERFORMANCE_DEGRADATION -> "Performance " + sigma + " " + direction + " baseline";
            case SUCCESS_RATE_DROP, PASS_RATE_DROP -> "Success rate " + sigma + " " + direction + " baseline";
            case RESOURCE_ANOMALY -> "Resource usage " + sigma + " " + direction + " normal";
            case TREND_CHANGE -> "Metric trend changed significantly";
            case SEASONAL_DEVIATION -> "Unusual deviation from seasonal pattern";
            case CONSECUTIVE_FAILURES -> metricName + " is " + sigma + " " + direction + " expected";
        };
    }
}
