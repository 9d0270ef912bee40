/**
 * Persistence seam and collaborator interfaces.
 *
 * <p>
 * {@link com.qualitysentinel.core.storage.AnomalyStore} is the only I/O the
 * core performs. Wrap any store in
 * {@link com.qualitysentinel.core.storage.TimeLimitedAnomalyStore} to bound
 * each call.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.storage;
