package com.qualitysentinel.core.alert;

import com.qualitysentinel.core.model.AlertLevel;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.RootCause;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.model.Suggestion;
import com.qualitysentinel.core.stats.Statistics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * How alerts for one {@link AnomalyType} are titled, worded and levelled.
 *
 * <h3>Placeholders</h3>
 * <ul>
 * <li>{@code {value}}: current value</li>
 * <li>{@code {baseline}}: expected value</li>
 * <li>{@code {deviation}}: percentage distance from the expected value</li>
 * <li>{@code {metricName}}, {@code {caseName}}, {@code {description}}</li>
 * </ul>
 * <p>
 * When enabled, the top 3 root causes and up to 3 distinct suggested actions
 * are appended to the message.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertTemplate {

    static final int MAX_ROOT_CAUSES = 3;
    static final int MAX_SUGGESTIONS = 3;

    private final AnomalyType type;
    private final String title;
    private final String messageTemplate;
    private final Map<Severity, AlertLevel> levelMapping;
    private final boolean includeRootCause;
    private final boolean includeSuggestions;

    public AlertTemplate(AnomalyType type, String title, String messageTemplate,
            Map<Severity, AlertLevel> levelMapping, boolean includeRootCause, boolean includeSuggestions) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.messageTemplate = Objects.requireNonNull(messageTemplate, "messageTemplate must not be null");
        Map<Severity, AlertLevel> mapping = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            mapping.put(s, Objects.requireNonNull(levelMapping.get(s), "no alert level for severity " + s.id()));
        }
        this.levelMapping = Collections.unmodifiableMap(mapping);
        this.includeRootCause = includeRootCause;
        this.includeSuggestions = includeSuggestions;
    }

    public AnomalyType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getMessageTemplate() {
        return messageTemplate;
    }

    public Map<Severity, AlertLevel> getLevelMapping() {
        return levelMapping;
    }

    public boolean isIncludeRootCause() {
        return includeRootCause;
    }

    public boolean isIncludeSuggestions() {
        return includeSuggestions;
    }

    public AlertLevel levelFor(Severity severity) {
        return levelMapping.get(severity);
    }

    /**
     * Render the full alert message for an anomaly.
     */
    public String render(Anomaly anomaly) {
        StringBuilder message = new StringBuilder(fill(anomaly));
        List<RootCause> causes = anomaly.getRootCauses();
        if (includeRootCause && !causes.isEmpty()) {
            message.append("\n\nRoot Causes:\n").append(formatRootCauses(causes));
        }
        if (includeSuggestions && !causes.isEmpty()) {
            String suggestions = formatSuggestions(causes);
            if (!suggestions.isEmpty()) {
                message.append("\n\nSuggested Actions:\n").append(suggestions);
            }
        }
        return message.toString();
    }

    String fill(Anomaly anomaly) {
        double pct = Math.abs(Statistics.safeDivide(anomaly.getCurrentValue() - anomaly.getExpectedValue(),
                Math.abs(anomaly.getExpectedValue()))) * 100;
        String caseName = anomaly.getCaseName().or(anomaly::getCaseId).orElse("Unknown");
        return messageTemplate
                .replace("{value}", number(anomaly.getCurrentValue()))
                .replace("{baseline}", number(anomaly.getExpectedValue()))
                .replace("{deviation}", String.format(Locale.ROOT, "%.1f", pct))
                .replace("{metricName}", anomaly.getMetricName())
                .replace("{caseName}", caseName)
                .replace("{description}", anomaly.getDescription());
    }

    private static String number(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return String.format(Locale.ROOT, "%.2f", v);
    }

    private static String formatRootCauses(List<RootCause> causes) {
        StringBuilder sb = new StringBuilder();
        int n = Math.min(MAX_ROOT_CAUSES, causes.size());
        for (int i = 0; i < n; i++) {
            RootCause rc = causes.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(". [").append(rc.getCategory().id()).append("] ")
                    .append(rc.getDescription())
                    .append(String.format(Locale.ROOT, " (%.0f%% confidence)", rc.getConfidence()));
        }
        return sb.toString();
    }

    private static String formatSuggestions(List<RootCause> causes) {
        Set<String> unique = new LinkedHashSet<>();
        for (RootCause rc : causes) {
            for (Suggestion s : rc.getSuggestions()) {
                unique.add(s.getAction());
            }
        }
        List<String> top = unique.stream().limit(MAX_SUGGESTIONS).collect(Collectors.toList());
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < top.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(". ").append(top.get(i));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "AlertTemplate{" + type.id() + ", '" + title + "'}";
    }
}
