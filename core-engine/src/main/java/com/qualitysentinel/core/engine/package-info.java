/**
 * The anomaly detection engine: ensemble voting over the enabled detectors,
 * classification, severity scoring, persistence and the anomaly lifecycle.
 *
 * <p>
 * Entry point:
 * {@link com.qualitysentinel.core.engine.AnomalyDetectionEngine}. Results
 * carry an explicit
 * {@link com.qualitysentinel.core.engine.DetectionResult.Status} that callers
 * must branch on before reading other fields.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.engine;
