package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.algorithms.ConsecutivePattern;
import com.qualitysentinel.core.baseline.BaselineBuilder;
import com.qualitysentinel.core.detection.Algorithm;
import com.qualitysentinel.core.detection.AnomalyDetector;
import com.qualitysentinel.core.detection.DetectionContext;
import com.qualitysentinel.core.detection.DetectorFactory;
import com.qualitysentinel.core.detection.Verdict;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyStatus;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.ExecutionResult;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.model.RootCause;
import com.qualitysentinel.core.model.SeverityResult;
import com.qualitysentinel.core.severity.SeverityEvaluator;
import com.qualitysentinel.core.severity.SeverityInput;
import com.qualitysentinel.core.stats.Statistics;
import com.qualitysentinel.core.storage.AnomalyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Runs the enabled detectors over a value, picks the primary signal, scores
 * it and persists the resulting {@link Anomaly}. Also owns the anomaly
 * lifecycle operations.
 *
 * <h3>Detection flow</h3>
 * <ol>
 * <li>Disabled config: {@link DetectionResult.Status#DISABLED}.</li>
 * <li>No stored baseline and fewer than {@code minDataPoints} history values:
 * {@link DetectionResult.Status#INSUFFICIENT_DATA}.</li>
 * <li>Every enabled detector that {@linkplain AnomalyDetector#canRun can run}
 * votes. Seasonal baselines are scaled for the sample timestamp first.</li>
 * <li>No vote: {@link DetectionResult.Status#NORMAL}, carrying the first
 * detector's deviation.</li>
 * <li>Otherwise the vote with the largest |deviation| wins; ties go to the
 * earlier {@link Algorithm}.</li>
 * <li>The type comes from {@link AnomalyClassifier}; severity from the
 * {@link SeverityEvaluator}, flagged as a regression when an anomaly on the
 * same metric was resolved within the last 7 days.</li>
 * </ol>
 *
 * <h3>Errors</h3>
 * <p>
 * Store failures propagate as
 * {@link com.qualitysentinel.core.storage.PersistenceException}; detection
 * never reports "normal" after a failed read or write. Lifecycle operations on
 * an unknown id return {@code false} and log a warning.
 * </p>
 *
 * <p>
 * Thread-safe as long as the store is: the engine holds no per-metric state.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    public static final Duration REGRESSION_LOOKBACK = Duration.ofDays(7);
    public static final Duration DEFAULT_STALE_AGE = Duration.ofDays(7);

    static final int FLAKY_MIN_EXECUTIONS = 10;
    static final int PASS_RATE_WINDOW = 10;
    static final String PATTERN_METRIC_SUFFIX = ":pattern";

    private final AnomalyStore store;
    private final BaselineBuilder baselineBuilder;
    private final Map<Algorithm, AnomalyDetector> detectors;
    private final SeverityEvaluator severityEvaluator;
    private final DetectionConfig defaultConfig;
    private final Clock clock;
    private final AtomicLong idCounter = new AtomicLong();

    /**
     * Engine with the built-in detector for every {@link Algorithm}.
     */
    public AnomalyDetectionEngine(AnomalyStore store, BaselineBuilder baselineBuilder,
            SeverityEvaluator severityEvaluator, DetectionConfig defaultConfig, Clock clock) {
        this(store, baselineBuilder, DetectorFactory.createAll(EnumSet.allOf(Algorithm.class)),
                severityEvaluator, defaultConfig, clock);
    }

    /**
     * @param detectors detectors to register; a later entry replaces an
     *                  earlier one for the same algorithm
     */
    public AnomalyDetectionEngine(AnomalyStore store, BaselineBuilder baselineBuilder,
            Collection<? extends AnomalyDetector> detectors, SeverityEvaluator severityEvaluator,
            DetectionConfig defaultConfig, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.baselineBuilder = Objects.requireNonNull(baselineBuilder, "baselineBuilder must not be null");
        this.severityEvaluator = Objects.requireNonNull(severityEvaluator, "severityEvaluator must not be null");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(detectors, "detectors must not be null");
        this.detectors = new EnumMap<>(Algorithm.class);
        for (AnomalyDetector d : detectors) {
            this.detectors.put(d.algorithm(), d);
        }
        LOG.info("Anomaly detection engine ready: detectors={}, defaults={}",
                this.detectors.keySet(), defaultConfig);
    }

    public DetectionConfig getDefaultConfig() {
        return defaultConfig;
    }

    // -------------------------------------------------------------------------
    // Detection
    // -------------------------------------------------------------------------

    /**
     * Check a single value.
     *
     * @param request value and context; must not be {@code null}
     * @return the detection result; for anomalies, the persisted anomaly
     * @throws com.qualitysentinel.core.storage.PersistenceException if the
     *         store fails
     */
    public DetectionResult detect(DetectionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        DetectionConfig config = request.getConfig().orElse(defaultConfig);
        if (!config.isEnabled()) {
            return DetectionResult.disabled();
        }

        String metric = request.getMetricName();
        Instant timestamp = request.getTimestamp().orElseGet(clock::instant);
        double[] history = request.getHistory();

        Baseline baseline = baselineBuilder.getBaselineAt(metric, timestamp.toEpochMilli()).orElse(null);
        if (baseline == null && history.length < config.getMinDataPoints()) {
            LOG.debug("Insufficient data for {}: no baseline, {} of {} history points",
                    metric, history.length, config.getMinDataPoints());
            return DetectionResult.insufficientData();
        }

        double threshold = config.getThreshold();
        DetectionContext context = new DetectionContext(metric, baseline, history, threshold);
        List<Verdict> verdicts = runDetectors(request.getValue(), context, config);

        Verdict primary = null;
        for (Verdict v : verdicts) {
            if (v.isAnomaly() && (primary == null || Math.abs(v.getDeviation()) > Math.abs(primary.getDeviation()))) {
                primary = v;
            }
        }
        if (primary == null) {
            double deviation = verdicts.isEmpty() ? 0 : verdicts.get(0).getDeviation();
            LOG.debug("{}={} normal (deviation {})", metric, request.getValue(), deviation);
            return DetectionResult.normal(deviation, threshold, baseline);
        }

        AnomalyType type = AnomalyClassifier.classify(metric, primary.getDeviation());
        SeverityInput severityInput = SeverityInput.builder()
                .deviation(primary.getDeviation())
                .type(type)
                .duration(Duration.ZERO)
                .regression(isRegression(metric))
                .build();
        SeverityResult severity = severityEvaluator.evaluate(severityInput);

        Anomaly anomaly = Anomaly.builder()
                .id(nextId())
                .type(type)
                .severity(severity.getSeverity())
                .detectedAt(timestamp)
                .metricName(metric)
                .currentValue(request.getValue())
                .expectedValue(baseline != null ? baseline.getMean() : Statistics.mean(history))
                .deviation(primary.getDeviation())
                .caseId(request.getCaseId().orElse(null))
                .caseName(request.getCaseName().orElse(null))
                .description(AnomalyClassifier.describe(type, primary.getDeviation(), metric))
                .severityResult(severity)
                .build();
        store.saveAnomaly(anomaly);

        LOG.info("Anomaly {} on {}: type={}, severity={}, algorithm={}, deviation={}",
                anomaly.getId(), metric, type.id(), severity.getSeverity().id(),
                primary.getAlgorithm().id(), primary.getDeviation());
        return DetectionResult.anomaly(primary.getAlgorithm(), anomaly, threshold, baseline);
    }

    private List<Verdict> runDetectors(double value, DetectionContext context, DetectionConfig config) {
        List<Verdict> verdicts = new ArrayList<>();
        for (Algorithm algorithm : config.getAlgorithms()) {
            AnomalyDetector detector = detectors.get(algorithm);
            if (detector == null) {
                LOG.warn("No detector registered for enabled algorithm {}", algorithm.id());
                continue;
            }
            if (detector.canRun(context)) {
                verdicts.add(detector.detect(value, context));
            }
        }
        return verdicts;
    }

    private boolean isRegression(String metricName) {
        Instant cutoff = clock.instant().minus(REGRESSION_LOOKBACK);
        return store.getAnomaliesByMetric(metricName).stream()
                .filter(a -> a.getStatus() == AnomalyStatus.RESOLVED)
                .map(Anomaly::getResolvedAt)
                .flatMap(Optional::stream)
                .anyMatch(resolvedAt -> resolvedAt.isAfter(cutoff));
    }

    /**
     * Check every metric of one test case. Metric names are stored as
     * {@code caseId:metric}.
     *
     * @param metrics metric name to current value
     */
    public CaseDetectionResult detectForCase(String caseId, Map<String, Double> metrics, DetectionConfig config) {
        Objects.requireNonNull(caseId, "caseId must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        Instant now = clock.instant();
        List<Anomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, Double> e : metrics.entrySet()) {
            DetectionResult result = detect(DetectionRequest.builder()
                    .metricName(caseId + ":" + e.getKey())
                    .value(e.getValue())
                    .timestamp(now)
                    .caseId(caseId)
                    .config(config)
                    .build());
            result.getAnomaly().ifPresent(anomalies::add);
        }
        return new CaseDetectionResult(caseId, anomalies);
    }

    /**
     * Check several samples at one timestamp, in order.
     *
     * @param timestamp shared timestamp; the engine clock when {@code null}
     */
    public List<DetectionResult> detectBatch(List<MetricSample> samples, Instant timestamp, DetectionConfig config) {
        Objects.requireNonNull(samples, "samples must not be null");
        Instant at = timestamp != null ? timestamp : clock.instant();
        List<DetectionResult> results = new ArrayList<>(samples.size());
        for (MetricSample s : samples) {
            results.add(detect(DetectionRequest.builder()
                    .metricName(s.getMetricName())
                    .value(s.getValue())
                    .timestamp(at)
                    .caseId(s.getCaseId().orElse(null))
                    .config(config)
                    .build()));
        }
        return results;
    }

    /**
     * Look for behavioural patterns in a case's pass/fail history: a failure
     * streak, flakiness over at least {@value #FLAKY_MIN_EXECUTIONS} runs and a
     * pass-rate change between two trailing windows of
     * {@value #PASS_RATE_WINDOW}. Each finding is persisted under the metric
     * {@code caseId:pattern}.
     */
    public List<Anomaly> detectPatterns(String caseId, List<ExecutionResult> results, DetectionConfig config) {
        Objects.requireNonNull(caseId, "caseId must not be null");
        Objects.requireNonNull(results, "results must not be null");
        DetectionThresholds thresholds = (config != null ? config : defaultConfig).getThresholds();
        Instant now = clock.instant();
        List<Anomaly> anomalies = new ArrayList<>();

        ConsecutivePattern.StreakResult streak = ConsecutivePattern.detectConsecutiveFailures(results,
                thresholds.getConsecutiveFailures(), ConsecutivePattern.DEFAULT_SUCCESS_THRESHOLD);
        if (streak.isAnomaly()) {
            int n = streak.getConsecutiveFailures();
            anomalies.add(patternAnomaly(caseId, AnomalyType.CONSECUTIVE_FAILURES, n,
                    SeverityInput.builder().deviation(n).type(AnomalyType.CONSECUTIVE_FAILURES)
                            .consecutiveFailures(n).build(),
                    "Detected " + n + " consecutive failures", now));
        }

        ConsecutivePattern.FlakyResult flaky = ConsecutivePattern.detectFlaky(results,
                FLAKY_MIN_EXECUTIONS, thresholds.getFlakyScore());
        if (flaky.isFlaky()) {
            anomalies.add(patternAnomaly(caseId, AnomalyType.FLAKY_PATTERN, flaky.getAlternations(),
                    SeverityInput.of(flaky.getAlternations(), AnomalyType.FLAKY_PATTERN),
                    String.format(Locale.ROOT, "Flaky test pattern: %.1f%% instability", flaky.getFlakyScore() * 100),
                    now));
        }

        ConsecutivePattern.PassRateChange rate = ConsecutivePattern.detectPassRateChange(results,
                PASS_RATE_WINDOW, thresholds.getPassRateDrop());
        if (rate.hasChange()) {
            double change = rate.getChange();
            AnomalyType type = change < 0 ? AnomalyType.SUCCESS_RATE_DROP : AnomalyType.TREND_CHANGE;
            anomalies.add(patternAnomaly(caseId, type, Math.abs(change),
                    SeverityInput.of(Math.abs(change), type),
                    String.format(Locale.ROOT, "Pass rate %s by %.1f%%",
                            change < 0 ? "dropped" : "increased", Math.abs(change) * 100),
                    now));
        }
        return anomalies;
    }

    private Anomaly patternAnomaly(String caseId, AnomalyType type, double deviation, SeverityInput input,
            String description, Instant at) {
        SeverityResult severity = severityEvaluator.evaluate(input);
        Anomaly anomaly = Anomaly.builder()
                .id(nextId())
                .type(type)
                .severity(severity.getSeverity())
                .detectedAt(at)
                .metricName(caseId + PATTERN_METRIC_SUFFIX)
                .currentValue(deviation)
                .expectedValue(0)
                .deviation(deviation)
                .caseId(caseId)
                .description(description)
                .severityResult(severity)
                .build();
        store.saveAnomaly(anomaly);
        LOG.info("Pattern anomaly {} for case {}: {}", anomaly.getId(), caseId, description);
        return anomaly;
    }

    private String nextId() {
        return "anomaly-" + clock.millis() + "-" + idCounter.incrementAndGet();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Move an anomaly to {@code status} and persist it.
     *
     * @return {@code true} if the status changed; {@code false} if the id is
     *         unknown or the anomaly already had that status
     * @throws IllegalStateException if the anomaly is already resolved
     */
    public boolean updateStatus(String anomalyId, AnomalyStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        Optional<Anomaly> found = store.getAnomaly(anomalyId);
        if (found.isEmpty()) {
            LOG.warn("Cannot move anomaly {} to {}: not found", anomalyId, status.id());
            return false;
        }
        Anomaly anomaly = found.get();
        boolean changed = anomaly.transitionTo(status, clock.instant());
        if (changed) {
            store.saveAnomaly(anomaly);
            LOG.info("Anomaly {} is now {}", anomalyId, status.id());
        }
        return changed;
    }

    public boolean acknowledge(String anomalyId) {
        return updateStatus(anomalyId, AnomalyStatus.ACKNOWLEDGED);
    }

    public boolean investigate(String anomalyId) {
        return updateStatus(anomalyId, AnomalyStatus.INVESTIGATING);
    }

    public boolean resolve(String anomalyId) {
        return updateStatus(anomalyId, AnomalyStatus.RESOLVED);
    }

    /**
     * Append root causes to a stored anomaly.
     *
     * @return {@code false} if the id is unknown
     */
    public boolean attachRootCauses(String anomalyId, List<RootCause> causes) {
        Objects.requireNonNull(causes, "causes must not be null");
        Optional<Anomaly> found = store.getAnomaly(anomalyId);
        if (found.isEmpty()) {
            LOG.warn("Cannot attach root causes to anomaly {}: not found", anomalyId);
            return false;
        }
        found.get().addRootCauses(causes);
        store.saveAnomaly(found.get());
        return true;
    }

    /**
     * Resolve every active anomaly detected longer than {@code maxAge} ago.
     *
     * @return number of anomalies resolved
     */
    public int autoResolveStale(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        Instant cutoff = clock.instant().minus(maxAge);
        int resolved = 0;
        for (Anomaly a : store.getActiveAnomalies()) {
            if (a.getDetectedAt().isBefore(cutoff) && resolve(a.getId())) {
                resolved++;
            }
        }
        if (resolved > 0) {
            LOG.info("Auto-resolved {} stale anomalies older than {}", resolved, maxAge);
        }
        return resolved;
    }

    public int autoResolveStale() {
        return autoResolveStale(DEFAULT_STALE_AGE);
    }

    /**
     * Delete resolved anomalies whose resolution is older than {@code age}.
     *
     * @return number deleted
     */
    public int purgeResolved(Duration age) {
        Objects.requireNonNull(age, "age must not be null");
        int purged = store.deleteResolvedBefore(clock.instant().minus(age));
        if (purged > 0) {
            LOG.info("Purged {} resolved anomalies older than {}", purged, age);
        }
        return purged;
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public Optional<Anomaly> getAnomaly(String anomalyId) {
        return store.getAnomaly(anomalyId);
    }

    public boolean deleteAnomaly(String anomalyId) {
        boolean deleted = store.deleteAnomaly(anomalyId);
        if (!deleted) {
            LOG.warn("Cannot delete anomaly {}: not found", anomalyId);
        }
        return deleted;
    }

    public List<Anomaly> getActiveAnomalies() {
        return store.getActiveAnomalies();
    }

    public List<Anomaly> getActiveAnomalies(AnomalyFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return store.getActiveAnomalies().stream().filter(filter).collect(Collectors.toList());
    }

    public List<Anomaly> getAnomaliesByTimeRange(Instant from, Instant to) {
        return store.getAnomaliesBetween(from, to);
    }

    /** Counts over every stored anomaly. */
    public AnomalyStatistics getStatistics() {
        return AnomalyStatistics.of(store.getAllAnomalies());
    }

    /** Counts over anomalies detected within {@code [from, to]}. */
    public AnomalyStatistics getStatistics(Instant from, Instant to) {
        return AnomalyStatistics.of(store.getAnomaliesBetween(from, to));
    }

    public void clearAll() {
        store.clearAnomalies();
        LOG.info("Cleared all anomalies");
    }
}
