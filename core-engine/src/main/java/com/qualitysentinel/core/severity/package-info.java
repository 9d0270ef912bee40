/**
 * Weighted-factor severity scoring, impact assessment and queue priority.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.severity;
