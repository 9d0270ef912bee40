package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.algorithms.ZScore;
import com.qualitysentinel.core.model.Baseline;

/**
 * Z-score against the stored baseline. Needs a baseline; ignores history.
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    @Override
    public Algorithm algorithm() {
        return Algorithm.ZSCORE;
    }

    @Override
    public boolean canRun(DetectionContext context) {
        return context.getBaseline().isPresent();
    }

    @Override
    public Verdict detect(double value, DetectionContext context) {
        Baseline baseline = context.getBaseline()
                .orElseThrow(() -> new IllegalStateException("z-score detector requires a baseline"));
        ZScore.Result r = ZScore.detect(value, baseline, context.getThreshold());
        return new Verdict(Algorithm.ZSCORE, r.isAnomaly(), r.getZScore(), baseline.getMean());
    }
}
