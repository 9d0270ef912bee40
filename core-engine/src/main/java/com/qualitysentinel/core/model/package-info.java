/**
 * Domain model shared by every stage of the detection pipeline.
 *
 * <ul>
 * <li>{@link com.qualitysentinel.core.model.DataPoint} and
 * {@link com.qualitysentinel.core.model.MetricSample}: raw observations</li>
 * <li>{@link com.qualitysentinel.core.model.Baseline}: what "normal" looks
 * like for one metric</li>
 * <li>{@link com.qualitysentinel.core.model.Anomaly}: a detected deviation and
 * its status lifecycle</li>
 * <li>{@link com.qualitysentinel.core.model.AnomalyAlert}: the rendered
 * notification</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.model;
