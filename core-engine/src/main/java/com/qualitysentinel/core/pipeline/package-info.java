/**
 * Facade wiring baseline building, detection, enrichment and alerting.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.pipeline;
