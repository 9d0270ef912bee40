/**
 * Pluggable per-algorithm detectors.
 *
 * <p>
 * All detectors implement the
 * {@link com.qualitysentinel.core.detection.AnomalyDetector}
 * interface and are instantiated via
 * {@link com.qualitysentinel.core.detection.DetectorFactory}.
 * Built-in detectors:
 * </p>
 * <ul>
 * <li>{@link com.qualitysentinel.core.detection.ZScoreDetector}: baseline
 * mean ± N × σ</li>
 * <li>{@link com.qualitysentinel.core.detection.ModifiedZScoreDetector}:
 * median and MAD of the history</li>
 * <li>{@link com.qualitysentinel.core.detection.IqrDetector}: Tukey
 * fences</li>
 * <li>{@link com.qualitysentinel.core.detection.MovingAverageDetector}:
 * trailing average ± N × σ</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add an algorithm, implement {@code AnomalyDetector}, add an
 * {@code Algorithm} constant and register it in
 * {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.detection;
