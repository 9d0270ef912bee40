/**
 * Alert rendering and suppression: per-type templates, deduplication,
 * convergence and cooldown.
 *
 * <p>
 * Entry point: {@link com.qualitysentinel.core.alert.AlertTrigger}.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.alert;
