package com.qualitysentinel.core.storage;

import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.RootCause;

import java.util.List;

/**
 * External collaborator that explains a finished {@link Anomaly}.
 *
 * <p>
 * Results are appended to {@link Anomaly#getRootCauses()}. Enrichment is
 * optional: a failing analyzer never blocks alerting.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RootCauseAnalyzer {

    /**
     * @param anomaly anomaly to explain
     * @return causes ordered by confidence, possibly empty
     */
    List<RootCause> analyze(Anomaly anomaly);
}
