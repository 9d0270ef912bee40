/**
 * Clock-driven expiring key-value caches used for short-lived alerting state.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.cache;
