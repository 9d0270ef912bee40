package com.qualitysentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link Algorithm} identifiers.
 *
 * <p>
 * This is the single point of extension when adding new algorithms: add the
 * enum constant and create the corresponding detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create a detector with default parameters.
     *
     * @param algorithm the algorithm; must not be {@code null}
     * @return a new detector
     */
    public static AnomalyDetector create(Algorithm algorithm) {
        Objects.requireNonNull(algorithm, "Algorithm must not be null");
        return switch (algorithm) {
            case ZSCORE -> new ZScoreDetector();
            case MODIFIED_ZSCORE -> new ModifiedZScoreDetector();
            case IQR -> new IqrDetector();
            case MOVING_AVERAGE -> new MovingAverageDetector();
        };
    }

    /**
     * Create detectors for every enabled algorithm, in precedence order.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param algorithms enabled algorithms; must not be {@code null}
     * @return unmodifiable list of detectors ordered by {@link Algorithm}
     *         declaration
     */
    public static List<AnomalyDetector> createAll(Set<Algorithm> algorithms) {
        Objects.requireNonNull(algorithms, "Algorithms must not be null");
        Set<Algorithm> ordered = algorithms.isEmpty() ? EnumSet.noneOf(Algorithm.class) : EnumSet.copyOf(algorithms);
        LOG.info("Creating {} detector(s): {}", ordered.size(), ordered);
        List<AnomalyDetector> detectors = ordered.stream()
                .map(DetectorFactory::create)
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
