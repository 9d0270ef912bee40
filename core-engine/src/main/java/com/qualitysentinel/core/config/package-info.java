/**
 * YAML configuration loading.
 *
 * <p>
 * {@link com.qualitysentinel.core.config.SentinelConfigLoader} reads
 * {@code sentinel.yml} into a
 * {@link com.qualitysentinel.core.config.SentinelConfig}, validates it and
 * converts each section into the immutable config object its component
 * takes.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.config;
