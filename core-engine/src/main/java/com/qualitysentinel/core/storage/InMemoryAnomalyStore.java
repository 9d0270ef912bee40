package com.qualitysentinel.core.storage;

import com.qualitysentinel.core.baseline.BaselineRecord;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyAlert;
import com.qualitysentinel.core.model.AnomalyStatus;
import com.qualitysentinel.core.model.HealthScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;

/**
 * Heap-backed {@link AnomalyStore}.
 *
 * <p>
 * Suitable for tests and for a single Flink operator instance. Health scores,
 * anomalies and alerts are each capped. Past the cap the oldest entry is
 * evicted, preferring resolved anomalies over active ones.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryAnomalyStore implements AnomalyStore {

    public static final int DEFAULT_MAX_HEALTH_SCORES = 365;
    public static final int DEFAULT_MAX_ANOMALIES = 10_000;
    public static final int DEFAULT_MAX_ALERTS = 10_000;

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAnomalyStore.class);

    private static final Comparator<Anomaly> NEWEST_FIRST =
            Comparator.comparing(Anomaly::getDetectedAt).reversed();

    // resolved before active, then oldest first
    private static final Comparator<Anomaly> EVICTION_ORDER =
            Comparator.comparing((Anomaly a) -> a.getStatus() != AnomalyStatus.RESOLVED)
                    .thenComparing(Anomaly::getDetectedAt);

    private final Map<String, BaselineRecord> baselines = new ConcurrentHashMap<>();
    private final Map<String, Anomaly> anomalies = new ConcurrentHashMap<>();
    private final Map<String, AnomalyAlert> alerts = new ConcurrentHashMap<>();
    private final ConcurrentNavigableMap<Instant, HealthScore> healthScores = new ConcurrentSkipListMap<>();
    private final int maxHealthScores;
    private final int maxAnomalies;
    private final int maxAlerts;

    public InMemoryAnomalyStore() {
        this(DEFAULT_MAX_HEALTH_SCORES);
    }

    public InMemoryAnomalyStore(int maxHealthScores) {
        this(maxHealthScores, DEFAULT_MAX_ANOMALIES, DEFAULT_MAX_ALERTS);
    }

    public InMemoryAnomalyStore(int maxHealthScores, int maxAnomalies, int maxAlerts) {
        if (maxHealthScores < 1) {
            throw new IllegalArgumentException("maxHealthScores must be >= 1, got: " + maxHealthScores);
        }
        if (maxAnomalies < 1) {
            throw new IllegalArgumentException("maxAnomalies must be >= 1, got: " + maxAnomalies);
        }
        if (maxAlerts < 1) {
            throw new IllegalArgumentException("maxAlerts must be >= 1, got: " + maxAlerts);
        }
        this.maxHealthScores = maxHealthScores;
        this.maxAnomalies = maxAnomalies;
        this.maxAlerts = maxAlerts;
    }

    @Override
    public Optional<BaselineRecord> getBaseline(String metricName) {
        return Optional.ofNullable(baselines.get(metricName));
    }

    @Override
    public void saveBaseline(BaselineRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        baselines.put(record.getMetricName(), record);
    }

    @Override
    public List<BaselineRecord> getAllBaselines() {
        return List.copyOf(baselines.values());
    }

    @Override
    public boolean deleteBaseline(String metricName) {
        return baselines.remove(metricName) != null;
    }

    @Override
    public void saveAnomaly(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        anomalies.put(anomaly.getId(), anomaly);
        while (anomalies.size() > maxAnomalies) {
            if (!evictOldestAnomaly()) {
                break;
            }
        }
    }

    @Override
    public Optional<Anomaly> getAnomaly(String id) {
        return Optional.ofNullable(anomalies.get(id));
    }

    @Override
    public List<Anomaly> getAllAnomalies() {
        return select(a -> true);
    }

    @Override
    public List<Anomaly> getActiveAnomalies() {
        return select(a -> a.getStatus() != AnomalyStatus.RESOLVED);
    }

    @Override
    public List<Anomaly> getAnomaliesByMetric(String metricName) {
        return select(a -> a.getMetricName().equals(metricName));
    }

    @Override
    public List<Anomaly> getAnomaliesBetween(Instant from, Instant to) {
        return select(a -> !a.getDetectedAt().isBefore(from) && !a.getDetectedAt().isAfter(to));
    }

    @Override
    public List<Anomaly> getRecentAnomalies(int limit) {
        List<Anomaly> all = select(a -> true);
        return all.size() > limit ? List.copyOf(all.subList(0, limit)) : all;
    }

    @Override
    public boolean deleteAnomaly(String id) {
        return anomalies.remove(id) != null;
    }

    @Override
    public int deleteResolvedBefore(Instant cutoff) {
        int removed = 0;
        for (Anomaly a : anomalies.values()) {
            if (a.getStatus() == AnomalyStatus.RESOLVED
                    && a.getResolvedAt().orElse(a.getDetectedAt()).isBefore(cutoff)
                    && anomalies.remove(a.getId(), a)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void clearAnomalies() {
        anomalies.clear();
    }

    @Override
    public void saveHealthScore(HealthScore score) {
        Objects.requireNonNull(score, "score must not be null");
        healthScores.put(score.getCalculatedAt(), score);
        while (healthScores.size() > maxHealthScores) {
            healthScores.pollFirstEntry();
        }
    }

    @Override
    public Optional<HealthScore> getLatestHealthScore() {
        Map.Entry<Instant, HealthScore> last = healthScores.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public List<HealthScore> getRecentHealthScores(int limit) {
        List<HealthScore> out = new ArrayList<>();
        for (HealthScore s : healthScores.descendingMap().values()) {
            if (out.size() >= limit) {
                break;
            }
            out.add(s);
        }
        return out;
    }

    @Override
    public void saveAlert(AnomalyAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        alerts.put(alert.getId(), alert);
        while (alerts.size() > maxAlerts) {
            Optional<AnomalyAlert> oldest = alerts.values().stream()
                    .min(Comparator.comparing(AnomalyAlert::getCreatedAt));
            if (oldest.isEmpty() || !alerts.remove(oldest.get().getId(), oldest.get())) {
                break;
            }
        }
    }

    @Override
    public Optional<AnomalyAlert> getAlert(String id) {
        return Optional.ofNullable(alerts.get(id));
    }

    @Override
    public List<AnomalyAlert> getRecentAlerts(int limit) {
        return alerts.values().stream()
                .sorted(Comparator.comparing(AnomalyAlert::getCreatedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public int deleteAlertsBefore(Instant cutoff) {
        int removed = 0;
        for (AnomalyAlert a : alerts.values()) {
            if (a.getCreatedAt().isBefore(cutoff) && alerts.remove(a.getId(), a)) {
                removed++;
            }
        }
        return removed;
    }

    private boolean evictOldestAnomaly() {
        Anomaly victim = null;
        for (Anomaly a : anomalies.values()) {
            if (victim == null || EVICTION_ORDER.compare(a, victim) < 0) {
                victim = a;
            }
        }
        if (victim == null || !anomalies.remove(victim.getId(), victim)) {
            return false;
        }
        LOG.debug("Anomaly store full ({}), evicted {} detected at {}", maxAnomalies, victim.getId(),
                victim.getDetectedAt());
        return true;
    }

    private List<Anomaly> select(Predicate<Anomaly> filter) {
        List<Anomaly> out = new ArrayList<>();
        for (Anomaly a : anomalies.values()) {
            if (filter.test(a)) {
                out.add(a);
            }
        }
        out.sort(NEWEST_FIRST);
        return out;
    }
}
