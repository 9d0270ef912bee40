/**
 * Apache Flink streaming job for Quality Sentinel.
 *
 * <p>
 * This package wires the core pipeline into a Flink job that consumes test
 * metric samples from Kafka, runs anomaly detection per metric, and publishes
 * surfaced alerts back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.qualitysentinel.flink.QualitySentinelJob}: main entry
 * point</li>
 * <li>{@link com.qualitysentinel.flink.MetricAnomalyProcessFunction}: keyed
 * process function</li>
 * <li>{@link com.qualitysentinel.flink.MetricHistory}: per-metric state</li>
 * <li>{@link com.qualitysentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.flink;
