package com.qualitysentinel.core.storage;

import com.qualitysentinel.core.baseline.BaselineRecord;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyAlert;
import com.qualitysentinel.core.model.HealthScore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Pluggable persistence for baselines, anomalies, health scores and alerts.
 *
 * <p>
 * Every method may throw {@link PersistenceException}. Implementations must
 * be safe for concurrent use. "Recent" queries return newest first.
 * </p>
 *
 * <p>
 * Anomalies are mutable objects; callers save them again after a status
 * change so stores that copy on write see the update.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyStore {

    // ---------------------------------------------------------------
    // Baselines
    // ---------------------------------------------------------------

    Optional<BaselineRecord> getBaseline(String metricName);

    /** Insert or replace the baseline for {@code record.getMetricName()}. */
    void saveBaseline(BaselineRecord record);

    List<BaselineRecord> getAllBaselines();

    /** @return {@code true} if a baseline was removed */
    boolean deleteBaseline(String metricName);

    // ---------------------------------------------------------------
    // Anomalies
    // ---------------------------------------------------------------

    /** Insert or replace by id. */
    void saveAnomaly(Anomaly anomaly);

    Optional<Anomaly> getAnomaly(String id);

    List<Anomaly> getAllAnomalies();

    /** @return anomalies not yet resolved */
    List<Anomaly> getActiveAnomalies();

    List<Anomaly> getAnomaliesByMetric(String metricName);

    /** @return anomalies detected in {@code [from, to]} */
    List<Anomaly> getAnomaliesBetween(Instant from, Instant to);

    /** @return up to {@code limit} anomalies, most recently detected first */
    List<Anomaly> getRecentAnomalies(int limit);

    boolean deleteAnomaly(String id);

    /**
     * Remove resolved anomalies whose resolution happened before
     * {@code cutoff}. An anomaly without a resolution time is judged by its
     * detection time.
     *
     * @return number of anomalies removed
     */
    int deleteResolvedBefore(Instant cutoff);

    void clearAnomalies();

    // ---------------------------------------------------------------
    // Health scores
    // ---------------------------------------------------------------

    void saveHealthScore(HealthScore score);

    Optional<HealthScore> getLatestHealthScore();

    List<HealthScore> getRecentHealthScores(int limit);

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    void saveAlert(AnomalyAlert alert);

    Optional<AnomalyAlert> getAlert(String id);

    List<AnomalyAlert> getRecentAlerts(int limit);

    /**
     * Remove alerts created before {@code cutoff}.
     *
     * @return number of alerts removed
     */
    int deleteAlertsBefore(Instant cutoff);
}
