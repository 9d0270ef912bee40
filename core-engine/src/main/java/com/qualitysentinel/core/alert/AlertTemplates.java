package com.qualitysentinel.core.alert;

import com.qualitysentinel.core.model.AlertLevel;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Built-in alert template for every {@link AnomalyType}.
 *
 * @since 1.0.0
 */
public final class AlertTemplates {

    private static final Map<AnomalyType, AlertTemplate> TEMPLATES = build();

    private AlertTemplates() {
        // utility class
    }

    public static AlertTemplate forType(AnomalyType type) {
        return TEMPLATES.get(type);
    }

    public static Map<AnomalyType, AlertTemplate> all() {
        return TEMPLATES;
    }

    private static Map<AnomalyType, AlertTemplate> build() {
        Map<Severity, AlertLevel> standard = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            standard.put(s, AlertLevel.fromSeverity(s));
        }
        // flaky alerts stay one level below the standard mapping at the top end
        Map<Severity, AlertLevel> flaky = new EnumMap<>(Severity.class);
        flaky.put(Severity.LOW, AlertLevel.INFO);
        flaky.put(Severity.MEDIUM, AlertLevel.WARNING);
        flaky.put(Severity.HIGH, AlertLevel.WARNING);
        flaky.put(Severity.CRITICAL, AlertLevel.CRITICAL);

        Map<AnomalyType, AlertTemplate> m = new EnumMap<>(AnomalyType.class);
        put(m, new AlertTemplate(AnomalyType.DURATION_SPIKE, "Duration Spike Detected",
                "Execution time spiked to {value}ms (baseline: {baseline}ms). {deviation}% above normal.",
                standard, true, true));
        put(m, new AlertTemplate(AnomalyType.PERFORMANCE_DEGRADATION, "Performance Degradation Detected",
                "{metricName} moved to {value} (baseline: {baseline}). {deviation}% deviation from normal.",
                standard, true, true));
        put(m, new AlertTemplate(AnomalyType.FAILURE_SPIKE, "Failure Spike Detected",
                "Failures rose to {value} (baseline: {baseline}). {deviation}% above normal.",
                standard, true, true));
        put(m, new AlertTemplate(AnomalyType.PASS_RATE_DROP, "Pass Rate Drop Detected",
                "Pass rate dropped to {value}% (baseline: {baseline}%). {deviation}% below normal.",
                standard, true, true));
        put(m, new AlertTemplate(AnomalyType.SUCCESS_RATE_DROP, "Success Rate Drop Detected",
                "Success rate dropped to {value} (baseline: {baseline}). {description}.",
                standard, true, true));
        put(m, new AlertTemplate(AnomalyType.CONSECUTIVE_FAILURES, "Consecutive Failures Alert",
                "{value} consecutive test failures detected. Immediate attention required.",
                standard, true, true));
        put(m, new AlertTemplate(AnomalyType.FLAKY_DETECTED, "Flaky Test Detected",
                "Test \"{caseName}\" shows flaky behavior. Pass rate: {value}%.",
                flaky, false, true));
        put(m, new AlertTemplate(AnomalyType.FLAKY_PATTERN, "Flaky Test Detected",
                "Test \"{caseName}\" shows flaky behavior. {description}.",
                flaky, false, true));
        put(m, new AlertTemplate(AnomalyType.RESOURCE_ANOMALY, "Resource Anomaly Detected",
                "Unusual resource consumption: {metricName} at {value} ({deviation}% deviation).",
                standard, true, true));
        put(m, new AlertTemplate(AnomalyType.TREND_CHANGE, "Pattern Break Detected",
                "Established pattern broken for {metricName}. Current: {value}, Expected: {baseline}.",
                standard, true, true));
        put(m, new AlertTemplate(AnomalyType.SEASONAL_DEVIATION, "Seasonal Deviation Detected",
                "{metricName} at {value} deviates from its seasonal expectation of {baseline}.",
                standard, true, true));
        return Collections.unmodifiableMap(m);
    }

    private static void put(Map<AnomalyType, AlertTemplate> m, AlertTemplate t) {
        m.put(t.getType(), t);
    }
}
