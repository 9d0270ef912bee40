/**
 * Stateless statistics and series preprocessing.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.stats;
