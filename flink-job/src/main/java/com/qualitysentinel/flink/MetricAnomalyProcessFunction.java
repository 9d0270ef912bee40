package com.qualitysentinel.flink;

import com.qualitysentinel.core.baseline.BaselineResult;
import com.qualitysentinel.core.config.SentinelConfig;
import com.qualitysentinel.core.model.AnomalyAlert;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.pipeline.AnomalyPipeline;
import com.qualitysentinel.core.pipeline.PipelineOutcome;
import com.qualitysentinel.core.storage.InMemoryAnomalyStore;
import com.qualitysentinel.core.storage.PersistenceException;
import com.qualitysentinel.core.storage.TimeLimitedAnomalyStore;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Flink {@link KeyedProcessFunction} that runs every metric sample through
 * the anomaly pipeline and emits the alerts that survive suppression.
 *
 * <p>
 * The stream is keyed by metric name. Each key keeps a bounded
 * {@link MetricHistory} in Flink managed state, so the history is
 * checkpointed and restored with the job. The pipeline itself (engine,
 * alert trigger, store) is built per parallel instance in
 * {@link #open(Configuration)}.
 * </p>
 *
 * <h3>Per-sample flow</h3>
 * <ol>
 * <li>drop history older than the detection window</li>
 * <li>detect against the history gathered so far</li>
 * <li>append the sample to the history</li>
 * <li>refit the baseline once enough new samples have arrived, or once the
 * stored baseline is older than {@code baseline.maxAgeHours}</li>
 * <li>emit the alert if one was surfaced</li>
 * </ol>
 *
 * <p>
 * A store failure during detection skips the sample and leaves the history
 * untouched. A failed refit is logged and counted; the outcome of the sample
 * is still emitted and the refit is retried on the next sample.
 * </p>
 *
 * <h3>Maintenance</h3>
 * <p>
 * A processing-time timer aligned to the cleanup interval purges expired
 * alerting state, resolves stale anomalies and drops resolved anomalies and
 * alerts older than the detection window.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricAnomalyProcessFunction
        extends KeyedProcessFunction<String, MetricSample, AnomalyAlert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricAnomalyProcessFunction.class);

    private final SentinelConfig sentinelConfig;
    private final int historySize;
    private final int rebuildInterval;
    private final long cleanupIntervalMs;

    private transient ValueState<MetricHistory> historyState;
    private transient TimeLimitedAnomalyStore store;
    private transient AnomalyPipeline pipeline;
    private transient SentinelMetrics metrics;
    private transient long lastCleanupMs;

    /**
     * @param sentinelConfig validated detection and alerting configuration
     * @param jobConfig      history size, rebuild and cleanup intervals
     */
    public MetricAnomalyProcessFunction(SentinelConfig sentinelConfig, JobConfig jobConfig) {
        this.sentinelConfig = Objects.requireNonNull(sentinelConfig, "sentinelConfig must not be null");
        Objects.requireNonNull(jobConfig, "jobConfig must not be null");
        this.historySize = jobConfig.getHistorySize();
        this.rebuildInterval = jobConfig.getBaselineRebuildInterval();
        this.cleanupIntervalMs = jobConfig.getCleanupIntervalMs();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        historyState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("metric-history", TypeInformation.of(MetricHistory.class)));

        SentinelConfig.Storage storage = sentinelConfig.getStorage();
        InMemoryAnomalyStore heap = new InMemoryAnomalyStore(InMemoryAnomalyStore.DEFAULT_MAX_HEALTH_SCORES,
                storage.getMaxAnomalies(), storage.getMaxAlerts());
        store = new TimeLimitedAnomalyStore(heap, storage.getTimeout(), storage.getIoThreads());
        pipeline = AnomalyPipeline.create(sentinelConfig, store, Clock.systemUTC());

        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("MetricAnomalyProcessFunction opened (historySize={}, rebuildEvery={})",
                historySize, rebuildInterval);
    }

    @Override
    public void close() {
        LOG.info("MetricAnomalyProcessFunction closing");
        if (store != null) {
            store.close();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MetricSample sample,
            KeyedProcessFunction<String, MetricSample, AnomalyAlert>.Context ctx,
            Collector<AnomalyAlert> out) throws Exception {
        long startNanos = System.nanoTime();

        MetricHistory history = historyState.value();
        if (history == null) {
            history = new MetricHistory(historySize);
        }

        try {
            PipelineOutcome outcome = advance(pipeline, history, sample, rebuildInterval, metrics);
            record(outcome, out);
        } catch (PersistenceException e) {
            // no verdict is emitted for this sample
            metrics.incrementDetectionFailures();
            LOG.error("Detection for {} aborted by store failure", ctx.getCurrentKey(), e);
            return;
        }
        historyState.update(history);

        long now = ctx.timerService().currentProcessingTime();
        ctx.timerService().registerProcessingTimeTimer((now / cleanupIntervalMs + 1) * cleanupIntervalMs);

        metrics.incrementSamplesProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, MetricSample, AnomalyAlert>.OnTimerContext ctx,
            Collector<AnomalyAlert> out) {
        // timers fire per key; clean once per interval for the whole instance
        if (timestamp - lastCleanupMs >= cleanupIntervalMs) {
            lastCleanupMs = timestamp;
            try {
                pipeline.cleanup();
            } catch (PersistenceException e) {
                metrics.incrementMaintenanceFailures();
                LOG.warn("Maintenance pass failed, retrying next interval", e);
            }
        }
    }

    private void record(PipelineOutcome outcome, Collector<AnomalyAlert> out) {
        if (!outcome.getDetection().isAnomaly()) {
            return;
        }
        metrics.incrementAnomaliesDetected();
        Optional<AnomalyAlert> alert = outcome.getSurfacedAlert();
        if (alert.isPresent()) {
            out.collect(alert.get());
            metrics.incrementAlertsNotified();
            LOG.info("Alert published: {} [{}]", alert.get().getTitle(), alert.get().getLevel());
        } else {
            metrics.incrementAlertsSuppressed();
        }
    }

    /**
     * Detect one sample against the values seen so far, then fold it into the
     * history and refit the baseline when due.
     *
     * @param metrics may be {@code null}
     * @throws PersistenceException if detection failed; the history is then
     *                              unchanged apart from window eviction
     */
    static PipelineOutcome advance(AnomalyPipeline pipeline, MetricHistory history, MetricSample sample,
            int rebuildInterval, SentinelMetrics metrics) {
        history.evictBefore(sample.getTimestamp() - pipeline.getRetention().toMillis());
        PipelineOutcome outcome = pipeline.process(sample, history.values());
        history.append(sample.toDataPoint());
        refit(pipeline, history, sample.getMetricName(), rebuildInterval, metrics);
        return outcome;
    }

    private static void refit(AnomalyPipeline pipeline, MetricHistory history, String metricName,
            int rebuildInterval, SentinelMetrics metrics) {
        try {
            if (!history.isRebuildDue(rebuildInterval) && !pipeline.isBaselineStale(metricName)) {
                return;
            }
            BaselineResult result = pipeline.rebuildBaseline(metricName, history.points());
            history.markRebuilt();
            if (result.isSuccess() && metrics != null) {
                metrics.incrementBaselineRebuilds();
            }
        } catch (PersistenceException e) {
            if (metrics != null) {
                metrics.incrementBaselineRebuildFailures();
            }
            LOG.warn("Baseline refit for {} failed, keeping the previous baseline", metricName, e);
        }
    }
}
