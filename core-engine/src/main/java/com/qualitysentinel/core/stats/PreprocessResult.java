package com.qualitysentinel.core.stats;

import com.qualitysentinel.core.model.DataPoint;

import java.util.List;

/**
 * Cleaned series plus bookkeeping of what preprocessing changed.
 *
 * @since 1.0.0
 */
public final class PreprocessResult {

    private final List<DataPoint> data;
    private final int removedOutliers;
    private final int filledMissing;
    private final SummaryStats stats;

    PreprocessResult(List<DataPoint> data, int removedOutliers, int filledMissing, SummaryStats stats) {
        this.data = List.copyOf(data);
        this.removedOutliers = removedOutliers;
        this.filledMissing = filledMissing;
        this.stats = stats;
    }

    /** @return time-ordered, unmodifiable series */
    public List<DataPoint> getData() {
        return data;
    }

    /** @return points dropped as outliers or zeros */
    public int getRemovedOutliers() {
        return removedOutliers;
    }

    public int getFilledMissing() {
        return filledMissing;
    }

    /** @return statistics of the final series */
    public SummaryStats getStats() {
        return stats;
    }
}
