package com.qualitysentinel.core.config;

import com.qualitysentinel.core.alert.AlertConfig;
import com.qualitysentinel.core.baseline.BaselineConfig;
import com.qualitysentinel.core.baseline.BaselineMethod;
import com.qualitysentinel.core.detection.Algorithm;
import com.qualitysentinel.core.engine.DetectionConfig;
import com.qualitysentinel.core.engine.DetectionThresholds;
import com.qualitysentinel.core.engine.Sensitivity;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.severity.SeverityWeights;
import com.qualitysentinel.core.storage.InMemoryAnomalyStore;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Top-level POJO for the {@code sentinel.yml} configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, shown with its default):
 * </p>
 *
 * <pre>
 * detection:
 *   enabled: true
 *   algorithms: [zscore, modified_zscore, iqr, moving_average]
 *   sensitivity: medium
 *   minDataPoints: 10
 *   detectionWindowDays: 30
 *   thresholds:
 *     zscore: ~            # unset: the sensitivity decides
 *     passRateDrop: 0.2
 *     consecutiveFailures: 3
 *     flakyScore: 0.3
 * alert:
 *   enabled: true
 *   minSeverity: low
 *   deduplicationWindowSeconds: 300
 *   convergenceWindowSeconds: 900
 *   maxAlertsPerWindow: 5
 *   cooldownPeriodSeconds: 1800
 * baseline:
 *   calculationMethod: moving_average
 *   windowSize: 30
 *   excludeAnomalies: true
 *   autoDetectSeasonality: false
 *   maxAgeHours: 24
 * severity:
 *   deviation: 0.35
 *   duration: 0.20
 *   frequency: 0.15
 *   impact: 0.30
 *   regressionPenalty: 15
 *   consecutiveBonus: 10
 *   typeMultipliers:
 *     failure_spike: 1.3
 * storage:
 *   timeoutMillis: 2000
 *   ioThreads: 4
 *   maxAnomalies: 10000
 *   maxAlerts: 10000
 * </pre>
 *
 * <p>
 * {@code detectionWindowDays} bounds both the samples a detection looks at
 * and how long resolved anomalies and alerts are kept.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after loading; the {@code to*} conversions assume
 * a valid config.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Detection detection = new Detection();
    private Alert alert = new Alert();
    private Baseline baseline = new Baseline();
    private SeverityModel severity = new SeverityModel();
    private Storage storage = new Storage();

    public Detection getDetection() {
        return detection;
    }

    public void setDetection(Detection detection) {
        this.detection = detection != null ? detection : new Detection();
    }

    public Alert getAlert() {
        return alert;
    }

    public void setAlert(Alert alert) {
        this.alert = alert != null ? alert : new Alert();
    }

    public Baseline getBaseline() {
        return baseline;
    }

    public void setBaseline(Baseline baseline) {
        this.baseline = baseline != null ? baseline : new Baseline();
    }

    public SeverityModel getSeverity() {
        return severity;
    }

    public void setSeverity(SeverityModel severity) {
        this.severity = severity != null ? severity : new SeverityModel();
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage != null ? storage : new Storage();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section. Collects all errors and throws a single
     * exception listing them.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        detection.validate(errors);
        alert.validate(errors);
        baseline.validate(errors);
        severity.validate(errors);
        storage.validate(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Sentinel configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Conversions
    // ---------------------------------------------------------------

    public DetectionConfig toDetectionConfig() {
        Set<Algorithm> algorithms = EnumSet.noneOf(Algorithm.class);
        detection.algorithms.forEach(id -> algorithms.add(Algorithm.fromId(id)));
        Thresholds t = detection.thresholds;
        return DetectionConfig.builder()
                .enabled(detection.enabled)
                .algorithms(algorithms)
                .sensitivity(Sensitivity.fromId(detection.sensitivity))
                .minDataPoints(detection.minDataPoints)
                .detectionWindowDays(detection.detectionWindowDays)
                .thresholds(DetectionThresholds.builder()
                        .zScore(t.zscore)
                        .passRateDrop(t.passRateDrop)
                        .consecutiveFailures(t.consecutiveFailures)
                        .flakyScore(t.flakyScore)
                        .build())
                .build();
    }

    public AlertConfig toAlertConfig() {
        return AlertConfig.builder()
                .enabled(alert.enabled)
                .minSeverity(Severity.fromId(alert.minSeverity))
                .deduplicationWindow(Duration.ofSeconds(alert.deduplicationWindowSeconds))
                .convergenceWindow(Duration.ofSeconds(alert.convergenceWindowSeconds))
                .maxAlertsPerWindow(alert.maxAlertsPerWindow)
                .cooldownPeriod(Duration.ofSeconds(alert.cooldownPeriodSeconds))
                .build();
    }

    public BaselineConfig toBaselineConfig() {
        return BaselineConfig.builder()
                .calculationMethod(BaselineMethod.fromId(baseline.calculationMethod))
                .windowSize(baseline.windowSize)
                .excludeAnomalies(baseline.excludeAnomalies)
                .build();
    }

    public SeverityWeights toSeverityWeights() {
        SeverityWeights.Builder b = SeverityWeights.builder()
                .deviation(severity.deviation)
                .duration(severity.duration)
                .frequency(severity.frequency)
                .impact(severity.impact)
                .regressionPenalty(severity.regressionPenalty)
                .consecutiveBonus(severity.consecutiveBonus);
        severity.typeMultipliers.forEach((type, m) -> b.typeMultiplier(anomalyType(type), m));
        return b.build();
    }

    private static AnomalyType anomalyType(String id) {
        return AnomalyType.valueOf(id.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "SentinelConfig{detection=" + detection + ", alert=" + alert + ", baseline=" + baseline + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** {@code detection:} section. */
    public static class Detection implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = true;
        private List<String> algorithms = new ArrayList<>(
                List.of("zscore", "modified_zscore", "iqr", "moving_average"));
        private String sensitivity = "medium";
        private int minDataPoints = DetectionConfig.DEFAULT_MIN_DATA_POINTS;
        private int detectionWindowDays = DetectionConfig.DEFAULT_WINDOW_DAYS;
        private Thresholds thresholds = new Thresholds();

        void validate(List<String> errors) {
            if (algorithms.isEmpty() && enabled) {
                errors.add("detection.algorithms must list at least one algorithm");
            }
            for (String id : algorithms) {
                try {
                    Algorithm.fromId(id);
                } catch (IllegalArgumentException e) {
                    errors.add("detection.algorithms: " + e.getMessage());
                }
            }
            try {
                Sensitivity.fromId(sensitivity);
            } catch (IllegalArgumentException e) {
                errors.add("detection.sensitivity: " + e.getMessage());
            }
            if (minDataPoints < 1) {
                errors.add("detection.minDataPoints must be >= 1");
            }
            if (detectionWindowDays < 1) {
                errors.add("detection.detectionWindowDays must be >= 1");
            }
            thresholds.validate(errors);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getAlgorithms() {
            return algorithms;
        }

        public void setAlgorithms(List<String> algorithms) {
            this.algorithms = algorithms != null ? new ArrayList<>(algorithms) : new ArrayList<>();
        }

        public String getSensitivity() {
            return sensitivity;
        }

        public void setSensitivity(String sensitivity) {
            this.sensitivity = sensitivity;
        }

        public int getMinDataPoints() {
            return minDataPoints;
        }

        public void setMinDataPoints(int minDataPoints) {
            this.minDataPoints = minDataPoints;
        }

        public int getDetectionWindowDays() {
            return detectionWindowDays;
        }

        public Duration getDetectionWindow() {
            return Duration.ofDays(detectionWindowDays);
        }

        public void setDetectionWindowDays(int detectionWindowDays) {
            this.detectionWindowDays = detectionWindowDays;
        }

        public Thresholds getThresholds() {
            return thresholds;
        }

        public void setThresholds(Thresholds thresholds) {
            this.thresholds = thresholds != null ? thresholds : new Thresholds();
        }

        @Override
        public String toString() {
            return "Detection{enabled=" + enabled + ", algorithms=" + algorithms + ", sensitivity=" + sensitivity + '}';
        }
    }

    /** {@code detection.thresholds:} section. */
    public static class Thresholds implements Serializable {

        private static final long serialVersionUID = 1L;

        private Double zscore;
        private double passRateDrop = 0.2;
        private int consecutiveFailures = 3;
        private double flakyScore = 0.3;

        void validate(List<String> errors) {
            if (zscore != null && !(zscore > 0)) {
                errors.add("detection.thresholds.zscore must be > 0");
            }
            if (passRateDrop <= 0 || passRateDrop > 1) {
                errors.add("detection.thresholds.passRateDrop must be within (0, 1]");
            }
            if (consecutiveFailures < 1) {
                errors.add("detection.thresholds.consecutiveFailures must be >= 1");
            }
            if (flakyScore <= 0 || flakyScore > 1) {
                errors.add("detection.thresholds.flakyScore must be within (0, 1]");
            }
        }

        public Double getZscore() {
            return zscore;
        }

        public void setZscore(Double zscore) {
            this.zscore = zscore;
        }

        public double getPassRateDrop() {
            return passRateDrop;
        }

        public void setPassRateDrop(double passRateDrop) {
            this.passRateDrop = passRateDrop;
        }

        public int getConsecutiveFailures() {
            return consecutiveFailures;
        }

        public void setConsecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
        }

        public double getFlakyScore() {
            return flakyScore;
        }

        public void setFlakyScore(double flakyScore) {
            this.flakyScore = flakyScore;
        }
    }

    /** {@code alert:} section. Windows are in seconds. */
    public static class Alert implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = true;
        private String minSeverity = "low";
        private long deduplicationWindowSeconds = 300;
        private long convergenceWindowSeconds = 900;
        private int maxAlertsPerWindow = 5;
        private long cooldownPeriodSeconds = 1800;

        void validate(List<String> errors) {
            try {
                Severity.fromId(minSeverity);
            } catch (IllegalArgumentException e) {
                errors.add("alert.minSeverity: " + e.getMessage());
            }
            if (deduplicationWindowSeconds <= 0) {
                errors.add("alert.deduplicationWindowSeconds must be > 0");
            }
            if (convergenceWindowSeconds <= 0) {
                errors.add("alert.convergenceWindowSeconds must be > 0");
            }
            if (maxAlertsPerWindow < 1) {
                errors.add("alert.maxAlertsPerWindow must be >= 1");
            }
            if (cooldownPeriodSeconds <= 0) {
                errors.add("alert.cooldownPeriodSeconds must be > 0");
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMinSeverity() {
            return minSeverity;
        }

        public void setMinSeverity(String minSeverity) {
            this.minSeverity = minSeverity;
        }

        public long getDeduplicationWindowSeconds() {
            return deduplicationWindowSeconds;
        }

        public void setDeduplicationWindowSeconds(long deduplicationWindowSeconds) {
            this.deduplicationWindowSeconds = deduplicationWindowSeconds;
        }

        public long getConvergenceWindowSeconds() {
            return convergenceWindowSeconds;
        }

        public void setConvergenceWindowSeconds(long convergenceWindowSeconds) {
            this.convergenceWindowSeconds = convergenceWindowSeconds;
        }

        public int getMaxAlertsPerWindow() {
            return maxAlertsPerWindow;
        }

        public void setMaxAlertsPerWindow(int maxAlertsPerWindow) {
            this.maxAlertsPerWindow = maxAlertsPerWindow;
        }

        public long getCooldownPeriodSeconds() {
            return cooldownPeriodSeconds;
        }

        public void setCooldownPeriodSeconds(long cooldownPeriodSeconds) {
            this.cooldownPeriodSeconds = cooldownPeriodSeconds;
        }

        @Override
        public String toString() {
            return "Alert{enabled=" + enabled + ", minSeverity=" + minSeverity + '}';
        }
    }

    /** {@code baseline:} section. */
    public static class Baseline implements Serializable {

        private static final long serialVersionUID = 1L;

        private String calculationMethod = "moving_average";
        private int windowSize = BaselineConfig.DEFAULT_WINDOW_SIZE;
        private boolean excludeAnomalies = true;
        private boolean autoDetectSeasonality;
        private long maxAgeHours = 24;

        void validate(List<String> errors) {
            try {
                BaselineMethod.fromId(calculationMethod);
            } catch (IllegalArgumentException e) {
                errors.add("baseline.calculationMethod: " + e.getMessage());
            }
            if (windowSize < 1) {
                errors.add("baseline.windowSize must be >= 1");
            }
            if (maxAgeHours <= 0) {
                errors.add("baseline.maxAgeHours must be > 0");
            }
        }

        public String getCalculationMethod() {
            return calculationMethod;
        }

        public void setCalculationMethod(String calculationMethod) {
            this.calculationMethod = calculationMethod;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public boolean isExcludeAnomalies() {
            return excludeAnomalies;
        }

        public void setExcludeAnomalies(boolean excludeAnomalies) {
            this.excludeAnomalies = excludeAnomalies;
        }

        public boolean isAutoDetectSeasonality() {
            return autoDetectSeasonality;
        }

        public void setAutoDetectSeasonality(boolean autoDetectSeasonality) {
            this.autoDetectSeasonality = autoDetectSeasonality;
        }

        public long getMaxAgeHours() {
            return maxAgeHours;
        }

        public void setMaxAgeHours(long maxAgeHours) {
            this.maxAgeHours = maxAgeHours;
        }

        public Duration getMaxAge() {
            return Duration.ofHours(maxAgeHours);
        }

        @Override
        public String toString() {
            return "Baseline{method=" + calculationMethod + ", windowSize=" + windowSize + '}';
        }
    }

    /** {@code severity:} section. */
    public static class SeverityModel implements Serializable {

        private static final long serialVersionUID = 1L;

        private double deviation = 0.35;
        private double duration = 0.20;
        private double frequency = 0.15;
        private double impact = 0.30;
        private double regressionPenalty = 15;
        private double consecutiveBonus = 10;
        private Map<String, Double> typeMultipliers = new LinkedHashMap<>();

        void validate(List<String> errors) {
            if (deviation < 0 || duration < 0 || frequency < 0 || impact < 0) {
                errors.add("severity weights must be >= 0");
            }
            if (regressionPenalty < 0 || consecutiveBonus < 0) {
                errors.add("severity.regressionPenalty and severity.consecutiveBonus must be >= 0");
            }
            typeMultipliers.forEach((type, m) -> {
                try {
                    anomalyType(type);
                } catch (IllegalArgumentException e) {
                    errors.add("severity.typeMultipliers: unknown anomaly type '" + type + "'");
                }
                if (m == null || !(m > 0)) {
                    errors.add("severity.typeMultipliers." + type + " must be > 0");
                }
            });
        }

        public double getDeviation() {
            return deviation;
        }

        public void setDeviation(double deviation) {
            this.deviation = deviation;
        }

        public double getDuration() {
            return duration;
        }

        public void setDuration(double duration) {
            this.duration = duration;
        }

        public double getFrequency() {
            return frequency;
        }

        public void setFrequency(double frequency) {
            this.frequency = frequency;
        }

        public double getImpact() {
            return impact;
        }

        public void setImpact(double impact) {
            this.impact = impact;
        }

        public double getRegressionPenalty() {
            return regressionPenalty;
        }

        public void setRegressionPenalty(double regressionPenalty) {
            this.regressionPenalty = regressionPenalty;
        }

        public double getConsecutiveBonus() {
            return consecutiveBonus;
        }

        public void setConsecutiveBonus(double consecutiveBonus) {
            this.consecutiveBonus = consecutiveBonus;
        }

        public Map<String, Double> getTypeMultipliers() {
            return typeMultipliers;
        }

        public void setTypeMultipliers(Map<String, Double> typeMultipliers) {
            this.typeMultipliers = typeMultipliers != null ? new LinkedHashMap<>(typeMultipliers)
                    : new LinkedHashMap<>();
        }
    }

    /** {@code storage:} section. */
    public static class Storage implements Serializable {

        private static final long serialVersionUID = 1L;

        private long timeoutMillis = 2000;
        private int ioThreads = 4;
        private int maxAnomalies = InMemoryAnomalyStore.DEFAULT_MAX_ANOMALIES;
        private int maxAlerts = InMemoryAnomalyStore.DEFAULT_MAX_ALERTS;

        void validate(List<String> errors) {
            if (timeoutMillis <= 0) {
                errors.add("storage.timeoutMillis must be > 0");
            }
            if (ioThreads < 1) {
                errors.add("storage.ioThreads must be >= 1");
            }
            if (maxAnomalies < 1) {
                errors.add("storage.maxAnomalies must be >= 1");
            }
            if (maxAlerts < 1) {
                errors.add("storage.maxAlerts must be >= 1");
            }
        }

        public long getTimeoutMillis() {
            return timeoutMillis;
        }

        public void setTimeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
        }

        public Duration getTimeout() {
            return Duration.ofMillis(timeoutMillis);
        }

        public int getIoThreads() {
            return ioThreads;
        }

        public void setIoThreads(int ioThreads) {
            this.ioThreads = ioThreads;
        }

        public int getMaxAnomalies() {
            return maxAnomalies;
        }

        public void setMaxAnomalies(int maxAnomalies) {
            this.maxAnomalies = maxAnomalies;
        }

        public int getMaxAlerts() {
            return maxAlerts;
        }

        public void setMaxAlerts(int maxAlerts) {
            this.maxAlerts = maxAlerts;
        }
    }
}
