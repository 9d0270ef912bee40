package com.qualitysentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Quality Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * Reporters are set up in {@code flink-conf.yaml} at cluster level; the job
 * only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code samples_processed_total}: metric samples evaluated</li>
 *   <li>{@code anomalies_detected_total}: samples judged anomalous</li>
 *   <li>{@code alerts_notified_total}: alerts published</li>
 *   <li>{@code alerts_suppressed_total}: alerts held back by thresholds, deduplication or convergence</li>
 *   <li>{@code detection_failures_total}: samples skipped because the store failed</li>
 *   <li>{@code baseline_rebuilds_total}: baseline refits</li>
 *   <li>{@code baseline_rebuild_failures_total}: refits lost to a store failure</li>
 *   <li>{@code maintenance_failures_total}: retention passes aborted by a store failure</li>
 *   <li>{@code processing_latency_ms}: per-sample latency histogram</li>
 * </ul>
 */
public class SentinelMetrics {

    private final Counter samplesProcessed;
    private final Counter anomaliesDetected;
    private final Counter alertsNotified;
    private final Counter alertsSuppressed;
    private final Counter detectionFailures;
    private final Counter baselineRebuilds;
    private final Counter baselineRebuildFailures;
    private final Counter maintenanceFailures;
    private final Histogram processingLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup sentinelGroup = metricGroup.addGroup("quality_sentinel");

        this.samplesProcessed = sentinelGroup.counter("samples_processed_total");
        this.anomaliesDetected = sentinelGroup.counter("anomalies_detected_total");
        this.alertsNotified = sentinelGroup.counter("alerts_notified_total");
        this.alertsSuppressed = sentinelGroup.counter("alerts_suppressed_total");
        this.detectionFailures = sentinelGroup.counter("detection_failures_total");
        this.baselineRebuilds = sentinelGroup.counter("baseline_rebuilds_total");
        this.baselineRebuildFailures = sentinelGroup.counter("baseline_rebuild_failures_total");
        this.maintenanceFailures = sentinelGroup.counter("maintenance_failures_total");

        // sliding window of 350 samples, exposes p50/p95/p99
        this.processingLatency = sentinelGroup
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementSamplesProcessed() {
        samplesProcessed.inc();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.inc();
    }

    public void incrementAlertsNotified() {
        alertsNotified.inc();
    }

    public void incrementAlertsSuppressed() {
        alertsSuppressed.inc();
    }

    public void incrementDetectionFailures() {
        detectionFailures.inc();
    }

    public void incrementBaselineRebuilds() {
        baselineRebuilds.inc();
    }

    public void incrementBaselineRebuildFailures() {
        baselineRebuildFailures.inc();
    }

    public void incrementMaintenanceFailures() {
        maintenanceFailures.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
