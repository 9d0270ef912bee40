/**
 * Seasonal cycle detection and multiplicative adjustment.
 *
 * <p>
 * The baseline builder deseasonalizes history with
 * {@link com.qualitysentinel.core.seasonality.SeasonalityAnalyzer#deseasonalize}
 * before fitting; the detection engine re-applies the same factor when it
 * compares a live value against that baseline.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.seasonality;
