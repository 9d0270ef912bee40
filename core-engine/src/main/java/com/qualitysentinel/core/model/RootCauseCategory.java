package com.qualitysentinel.core.model;

import java.util.Locale;

/**
 * Broad classification of why an anomaly occurred.
 *
 * @since 1.0.0
 */
public enum RootCauseCategory {
    LOCATOR_CHANGE,
    TIMING_ISSUE,
    ENVIRONMENT_CHANGE,
    CODE_CHANGE,
    DATA_ISSUE,
    NETWORK_ISSUE,
    RESOURCE_CONSTRAINT;

    /** @return lower-case identifier, e.g. {@code timing_issue} */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
