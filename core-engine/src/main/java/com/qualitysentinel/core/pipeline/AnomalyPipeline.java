package com.qualitysentinel.core.pipeline;

import com.qualitysentinel.core.alert.AlertNotification;
import com.qualitysentinel.core.alert.AlertTrigger;
import com.qualitysentinel.core.baseline.BaselineBuilder;
import com.qualitysentinel.core.baseline.BaselineConfig;
import com.qualitysentinel.core.baseline.BaselineResult;
import com.qualitysentinel.core.config.SentinelConfig;
import com.qualitysentinel.core.engine.AnomalyDetectionEngine;
import com.qualitysentinel.core.engine.DetectionRequest;
import com.qualitysentinel.core.engine.DetectionResult;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.DataPoint;
import com.qualitysentinel.core.model.HealthScore;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.model.RootCause;
import com.qualitysentinel.core.seasonality.SeasonalityAnalyzer;
import com.qualitysentinel.core.severity.SeverityEvaluator;
import com.qualitysentinel.core.stats.DataPreprocessor;
import com.qualitysentinel.core.storage.AnomalyStore;
import com.qualitysentinel.core.storage.PersistenceException;
import com.qualitysentinel.core.storage.RootCauseAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns one wired set of components and runs a metric sample through
 * detection, optional root-cause enrichment and alerting.
 *
 * <p>
 * Instances are built explicitly, usually with
 * {@link #create(SentinelConfig, AnomalyStore, Clock)}; there is no shared
 * global instance. Surfaced alerts are saved to the store.
 * </p>
 *
 * <h3>Failure handling</h3>
 * <p>
 * Detection failures propagate. Once an alert has been surfaced it is
 * returned even if saving it fails, since the trigger already counts it as
 * sent. Root-cause enrichment is best effort: a failing analyzer is logged
 * and the alert goes out without causes.
 * </p>
 *
 * <h3>Retention</h3>
 * <p>
 * {@link #cleanup()} resolves stale anomalies, then drops resolved anomalies
 * and alerts older than the detection window.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyPipeline.class);

    private final AnomalyStore store;
    private final BaselineBuilder baselineBuilder;
    private final AnomalyDetectionEngine engine;
    private final AlertTrigger alertTrigger;
    private final BaselineConfig baselineConfig;
    private final boolean autoDetectSeasonality;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final Duration baselineMaxAge;
    private final Duration retention;
    private final Clock clock;

    /**
     * @param rootCauseAnalyzer optional enrichment; may be {@code null}
     * @param baselineMaxAge    age past which a stored baseline is refit
     * @param retention         how long resolved anomalies and alerts are kept
     */
    public AnomalyPipeline(AnomalyStore store, BaselineBuilder baselineBuilder, AnomalyDetectionEngine engine,
            AlertTrigger alertTrigger, BaselineConfig baselineConfig, boolean autoDetectSeasonality,
            RootCauseAnalyzer rootCauseAnalyzer, Duration baselineMaxAge, Duration retention, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.baselineBuilder = Objects.requireNonNull(baselineBuilder, "baselineBuilder must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.alertTrigger = Objects.requireNonNull(alertTrigger, "alertTrigger must not be null");
        this.baselineConfig = Objects.requireNonNull(baselineConfig, "baselineConfig must not be null");
        this.autoDetectSeasonality = autoDetectSeasonality;
        this.rootCauseAnalyzer = rootCauseAnalyzer;
        this.baselineMaxAge = Objects.requireNonNull(baselineMaxAge, "baselineMaxAge must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Wire every component from a validated configuration.
     */
    public static AnomalyPipeline create(SentinelConfig config, AnomalyStore store, Clock clock) {
        return create(config, store, clock, null);
    }

    public static AnomalyPipeline create(SentinelConfig config, AnomalyStore store, Clock clock,
            RootCauseAnalyzer rootCauseAnalyzer) {
        Objects.requireNonNull(config, "config must not be null");
        BaselineBuilder baselines = new BaselineBuilder(store, new DataPreprocessor(), new SeasonalityAnalyzer(), clock);
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine(store, baselines,
                new SeverityEvaluator(config.toSeverityWeights()), config.toDetectionConfig(), clock);
        AlertTrigger trigger = new AlertTrigger(config.toAlertConfig(), clock);
        return new AnomalyPipeline(store, baselines, engine, trigger, config.toBaselineConfig(),
                config.getBaseline().isAutoDetectSeasonality(), rootCauseAnalyzer,
                config.getBaseline().getMaxAge(), config.getDetection().getDetectionWindow(), clock);
    }

    // -------------------------------------------------------------------------
    // Operations
    // -------------------------------------------------------------------------

    /**
     * Refit and store the baseline for a metric.
     */
    public BaselineResult rebuildBaseline(String metricName, List<DataPoint> history) {
        BaselineResult result = baselineBuilder.build(metricName, history, baselineConfig, autoDetectSeasonality);
        if (!result.isSuccess()) {
            LOG.debug("Baseline for {} not rebuilt: {}", metricName,
                    result.getError().map(Throwable::getMessage).orElse("unknown"));
        }
        return result;
    }

    /**
     * @return {@code true} if a baseline is stored for the metric and it is
     *         older than the configured maximum age
     */
    public boolean isBaselineStale(String metricName) {
        return baselineBuilder.getBaseline(metricName).isPresent()
                && baselineBuilder.needsUpdate(metricName, baselineMaxAge);
    }

    /**
     * Detect, enrich and alert on one sample.
     *
     * @param history recent values of the same metric, oldest first
     */
    public PipelineOutcome process(MetricSample sample, double[] history) {
        Objects.requireNonNull(sample, "sample must not be null");
        DetectionResult detection = engine.detect(DetectionRequest.builder()
                .metricName(sample.getMetricName())
                .value(sample.getValue())
                .timestamp(Instant.ofEpochMilli(sample.getTimestamp()))
                .caseId(sample.getCaseId().orElse(null))
                .history(history)
                .build());

        Optional<Anomaly> anomaly = detection.getAnomaly();
        if (anomaly.isEmpty()) {
            return new PipelineOutcome(detection, null);
        }
        enrich(anomaly.get());
        AlertNotification notification = alertTrigger.triggerFromAnomaly(anomaly.get());
        if (notification.shouldNotify()) {
            persist(notification);
        } else {
            LOG.debug("Alert for {} suppressed: {}", anomaly.get().getId(), notification.getReason().orElse(""));
        }
        return new PipelineOutcome(detection, notification);
    }

    private void enrich(Anomaly anomaly) {
        if (rootCauseAnalyzer == null) {
            return;
        }
        try {
            List<RootCause> causes = rootCauseAnalyzer.analyze(anomaly);
            if (causes != null && !causes.isEmpty()) {
                engine.attachRootCauses(anomaly.getId(), causes);
            }
        } catch (RuntimeException e) {
            LOG.warn("Root-cause analysis failed for anomaly {}, alerting without causes", anomaly.getId(), e);
        }
    }

    /**
     * Store a new health reading and alert if it dropped sharply from the
     * previous stored one.
     */
    public Optional<AlertNotification> processHealthScore(HealthScore current) {
        Objects.requireNonNull(current, "current must not be null");
        HealthScore previous = store.getLatestHealthScore().orElse(null);
        store.saveHealthScore(current);
        Optional<AlertNotification> notification = alertTrigger.triggerFromHealthScore(current, previous);
        notification.filter(AlertNotification::shouldNotify).ifPresent(this::persist);
        return notification;
    }

    private void persist(AlertNotification notification) {
        try {
            store.saveAlert(notification.getAlert());
        } catch (PersistenceException e) {
            LOG.warn("Alert {} surfaced but not saved", notification.getAlert().getId(), e);
        }
    }

    /**
     * Purge expired alerting state, resolve stale anomalies and drop resolved
     * anomalies and alerts older than the retention.
     *
     * @throws PersistenceException if the store fails; alerting state is
     *                              purged regardless
     */
    public void cleanup() {
        alertTrigger.cleanup();
        engine.autoResolveStale();
        engine.purgeResolved(retention);
        int alerts = store.deleteAlertsBefore(clock.instant().minus(retention));
        if (alerts > 0) {
            LOG.info("Purged {} alerts older than {}", alerts, retention);
        }
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public AnomalyDetectionEngine getEngine() {
        return engine;
    }

    public AlertTrigger getAlertTrigger() {
        return alertTrigger;
    }

    public BaselineBuilder getBaselineBuilder() {
        return baselineBuilder;
    }

    public BaselineConfig getBaselineConfig() {
        return baselineConfig;
    }

    /** @return how far back samples and stored anomalies stay relevant */
    public Duration getRetention() {
        return retention;
    }
}
