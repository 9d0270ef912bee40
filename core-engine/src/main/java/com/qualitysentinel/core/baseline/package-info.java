/**
 * Baseline fitting and lookup.
 *
 * <p>
 * {@link com.qualitysentinel.core.baseline.BaselineBuilder} returns a
 * {@link com.qualitysentinel.core.baseline.BaselineResult} instead of
 * throwing on empty input.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.baseline;
