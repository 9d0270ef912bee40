package com.qualitysentinel.core.detection;

/**
 * Contract for all detection algorithms run by the engine.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: the same instance is
 * shared across metrics and threads, and everything it needs arrives in the
 * {@link DetectionContext}.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDetector {

    /**
     * @return the algorithm this detector implements
     */
    Algorithm algorithm();

    /**
     * Whether the context carries enough data for this detector to run.
     * Detectors that cannot run are skipped rather than voting.
     *
     * @param context detection inputs
     * @return {@code true} if {@link #detect} may be called
     */
    boolean canRun(DetectionContext context);

    /**
     * Judge a single value.
     *
     * @param value   candidate value
     * @param context detection inputs; {@link #canRun} must have returned
     *                {@code true}
     * @return this detector's verdict
     */
    Verdict detect(double value, DetectionContext context);
}
