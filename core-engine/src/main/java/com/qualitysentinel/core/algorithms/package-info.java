/**
 * Stateless detection algorithms.
 *
 * <p>
 * Each class exposes static functions over a candidate value and either a
 * {@link com.qualitysentinel.core.model.Baseline} or a raw history window.
 * The per-algorithm adapters in {@code com.qualitysentinel.core.detection}
 * wrap them behind a common interface.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.algorithms;
