package com.qualitysentinel.core.detection;

import java.util.Locale;

/**
 * Detection algorithms that can be enabled in a
 * {@link com.qualitysentinel.core.engine.DetectionConfig}.
 *
 * <p>
 * Declaration order is the tie-break precedence when two algorithms report
 * the same deviation magnitude.
 * </p>
 *
 * @since 1.0.0
 */
public enum Algorithm {

    ZSCORE,
    MODIFIED_ZSCORE,
    IQR,
    MOVING_AVERAGE;

    /** @return identifier used in configuration and results, e.g. {@code "moving_average"} */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param id identifier, case-insensitive
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static Algorithm fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Algorithm must not be null or blank");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown algorithm: '" + id
                    + "'. Supported: zscore, modified_zscore, iqr, moving_average", e);
        }
    }
}
