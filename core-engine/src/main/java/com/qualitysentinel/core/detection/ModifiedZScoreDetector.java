package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.algorithms.ZScore;
import com.qualitysentinel.core.stats.Statistics;

/**
 * MAD-based modified z-score over the raw history.
 *
 * <p>
 * Runs with at least {@value #MIN_HISTORY} historical points. The threshold
 * is the context threshold plus {@value #THRESHOLD_OFFSET}.
 * </p>
 *
 * @since 1.0.0
 */
public class ModifiedZScoreDetector implements AnomalyDetector {

    static final int MIN_HISTORY = 5;
    static final double THRESHOLD_OFFSET = 0.5;

    @Override
    public Algorithm algorithm() {
        return Algorithm.MODIFIED_ZSCORE;
    }

    @Override
    public boolean canRun(DetectionContext context) {
        return context.getHistorySize() >= MIN_HISTORY;
    }

    @Override
    public Verdict detect(double value, DetectionContext context) {
        double[] history = context.getHistory();
        ZScore.Result r = ZScore.detectModified(value, history, context.getThreshold() + THRESHOLD_OFFSET);
        return new Verdict(Algorithm.MODIFIED_ZSCORE, r.isAnomaly(), r.getZScore(), Statistics.median(history));
    }
}
