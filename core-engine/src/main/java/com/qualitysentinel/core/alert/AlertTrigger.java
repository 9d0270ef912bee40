package com.qualitysentinel.core.alert;

import com.qualitysentinel.core.cache.ExpiringCache;
import com.qualitysentinel.core.cache.InMemoryExpiringCache;
import com.qualitysentinel.core.model.AlertLevel;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyAlert;
import com.qualitysentinel.core.model.HealthScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Turns anomalies into alerts and decides which of them to surface.
 *
 * <h3>Suppression order for anomaly alerts</h3>
 * <ol>
 * <li><b>Disabled</b> or severity below {@code minSeverity}.</li>
 * <li><b>Cooldown</b>: a title whose convergence group overflowed stays
 * silent until its cooldown elapses, whatever the other checks would say.</li>
 * <li><b>Deduplication</b>: an alert with the same title and anomaly-id
 * prefix (first two {@code -}-separated segments) within the deduplication
 * window. Convergence state is not advanced.</li>
 * <li><b>Convergence</b>: more than {@code maxAlertsPerWindow} alerts with the
 * same title within the convergence window of the group's last alert. The
 * overflowing alert arms the cooldown.</li>
 * </ol>
 * <p>
 * Surviving alerts are tracked under their deduplication key and returned
 * with {@code shouldNotify=true}. Health-score alerts only go through
 * deduplication.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The three state maps live in {@link ExpiringCache}s driven by the injected
 * clock. Expired entries stop counting immediately; {@link #cleanup()}
 * reclaims their memory and is scheduled by the caller.
 * </p>
 *
 * <p>
 * <strong>Single-process only.</strong> Public methods are
 * {@code synchronized}, which makes one instance safe to share between
 * threads. Running several instances (for example several Flink subtasks)
 * gives each its own independent suppression state; a multi-instance
 * deployment needs these maps moved to a shared store with per-key atomic
 * check-and-set.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertTrigger {

    private static final Logger LOG = LoggerFactory.getLogger(AlertTrigger.class);

    public static final String HEALTH_ALERT_TITLE = "Health Score Dropped";
    static final double HEALTH_DROP_WARNING = 10;
    static final double HEALTH_DROP_CRITICAL = 20;

    private final AtomicReference<AlertConfig> config;
    private final Clock clock;
    private final ExpiringCache<String, List<AnomalyAlert>> recentAlerts;
    private final ExpiringCache<String, ConvergenceGroup> convergenceGroups;
    private final ExpiringCache<String, Instant> cooldownUntil;
    private final AtomicLong idCounter = new AtomicLong();

    public AlertTrigger(AlertConfig config, Clock clock) {
        this.config = new AtomicReference<>(Objects.requireNonNull(config, "config must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.recentAlerts = new InMemoryExpiringCache<>(clock);
        this.convergenceGroups = new InMemoryExpiringCache<>(clock);
        this.cooldownUntil = new InMemoryExpiringCache<>(clock);
        LOG.info("Alert trigger ready: {}", config);
    }

    // -------------------------------------------------------------------------
    // Triggering
    // -------------------------------------------------------------------------

    /**
     * Render an alert for the anomaly and run it through suppression.
     *
     * @return the alert and the notify decision; never {@code null}
     */
    public synchronized AlertNotification triggerFromAnomaly(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        AlertConfig cfg = config.get();
        AnomalyAlert alert = createAlert(anomaly);

        if (!cfg.isEnabled()) {
            return AlertNotification.suppressed(alert, "Alerts disabled");
        }
        if (!anomaly.getSeverity().isAtLeast(cfg.getMinSeverity())) {
            return AlertNotification.suppressed(alert, "Severity " + anomaly.getSeverity().id()
                    + " below threshold " + cfg.getMinSeverity().id());
        }

        Instant now = clock.instant();
        String title = alert.getTitle();

        Optional<Instant> cooldownEnd = cooldownUntil.get(title).filter(now::isBefore);
        if (cooldownEnd.isPresent()) {
            long remaining = Duration.between(now, cooldownEnd.get()).toMillis();
            LOG.debug("Alert '{}' for {} suppressed: cooldown", title, anomaly.getId());
            return AlertNotification.suppressed(alert, "In cooldown (" + remaining + "ms remaining)");
        }

        if (isDuplicate(alert, now, cfg)) {
            LOG.debug("Alert '{}' for {} suppressed: duplicate", title, anomaly.getId());
            return AlertNotification.suppressed(alert,
                    "Duplicate alert (Same alert within " + cfg.getDeduplicationWindow().toSeconds() + "s)");
        }

        ConvergenceGroup group = convergenceGroups.get(title)
                .map(g -> g.record(alert.getId(), now))
                .orElseGet(() -> ConvergenceGroup.start(title, alert.getId(), now));
        convergenceGroups.put(title, group, cfg.getConvergenceWindow());
        if (group.getCount() > cfg.getMaxAlertsPerWindow()) {
            Instant until = now.plus(cfg.getCooldownPeriod());
            cooldownUntil.putUntil(title, until, until);
            LOG.info("Alert '{}' converged after {} alerts; cooling down until {}", title, group.getCount(), until);
            return AlertNotification.converged(alert, group.getCount());
        }

        track(alert, cfg);
        LOG.info("Alert {} '{}' ({}) raised for anomaly {}", alert.getId(), title, alert.getLevel().id(),
                anomaly.getId());
        return AlertNotification.notify(alert);
    }

    /**
     * Raise an alert when the overall health score dropped by at least 10
     * points; {@code CRITICAL} from 20 points.
     *
     * @param previous the preceding reading; no alert without one
     * @return empty when alerts are disabled or the drop is too small
     */
    public synchronized Optional<AlertNotification> triggerFromHealthScore(HealthScore current, HealthScore previous) {
        Objects.requireNonNull(current, "current must not be null");
        AlertConfig cfg = config.get();
        if (!cfg.isEnabled() || previous == null) {
            return Optional.empty();
        }
        double drop = previous.getOverall() - current.getOverall();
        if (drop < HEALTH_DROP_WARNING) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        AnomalyAlert alert = AnomalyAlert.builder()
                .id(nextId(now))
                .anomalyId("health-score-" + current.getCalculatedAt().toEpochMilli())
                .level(drop >= HEALTH_DROP_CRITICAL ? AlertLevel.CRITICAL : AlertLevel.WARNING)
                .title(HEALTH_ALERT_TITLE)
                .message(String.format(Locale.ROOT,
                        "Overall health score dropped from %.1f to %.1f (%.1f point decrease).",
                        previous.getOverall(), current.getOverall(), drop))
                .createdAt(now)
                .build();

        if (isDuplicate(alert, now, cfg)) {
            return Optional.of(AlertNotification.suppressed(alert, "Duplicate"));
        }
        track(alert, cfg);
        LOG.info("Health score alert {} ({}): {} -> {}", alert.getId(), alert.getLevel().id(),
                previous.getOverall(), current.getOverall());
        return Optional.of(AlertNotification.notify(alert));
    }

    private AnomalyAlert createAlert(Anomaly anomaly) {
        AlertTemplate template = AlertTemplates.forType(anomaly.getType());
        Instant now = clock.instant();
        return AnomalyAlert.builder()
                .id(nextId(now))
                .anomalyId(anomaly.getId())
                .level(template.levelFor(anomaly.getSeverity()))
                .title(template.getTitle())
                .message(template.render(anomaly))
                .createdAt(now)
                .build();
    }

    private String nextId(Instant now) {
        return "alert-" + now.toEpochMilli() + "-" + idCounter.incrementAndGet();
    }

    static String deduplicationKey(AnomalyAlert alert) {
        String[] parts = alert.getAnomalyId().split("-", -1);
        String prefix = parts.length >= 2 ? parts[0] + "-" + parts[1] : parts[0];
        return alert.getTitle() + ":" + prefix;
    }

    private boolean isDuplicate(AnomalyAlert alert, Instant now, AlertConfig cfg) {
        Duration window = cfg.getDeduplicationWindow();
        return recentAlerts.get(deduplicationKey(alert)).orElse(List.of()).stream()
                .anyMatch(a -> Duration.between(a.getCreatedAt(), now).compareTo(window) < 0);
    }

    private void track(AnomalyAlert alert, AlertConfig cfg) {
        String key = deduplicationKey(alert);
        List<AnomalyAlert> alerts = recentAlerts.get(key).orElseGet(ArrayList::new);
        alerts.add(alert);
        recentAlerts.put(key, alerts, cfg.getDeduplicationWindow().multipliedBy(2));
    }

    // -------------------------------------------------------------------------
    // Tracked alerts
    // -------------------------------------------------------------------------

    /** @return unacknowledged tracked alerts, newest first */
    public synchronized List<AnomalyAlert> getPendingAlerts() {
        return trackedAlerts().stream()
                .filter(a -> !a.isAcknowledged())
                .sorted(Comparator.comparing(AnomalyAlert::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    /**
     * Acknowledge a tracked alert. Acknowledging an already acknowledged alert
     * changes nothing and still returns {@code true}.
     *
     * @return {@code false} if no tracked alert has this id
     */
    public synchronized boolean acknowledgeAlert(String alertId) {
        Optional<AnomalyAlert> alert = trackedAlerts().stream()
                .filter(a -> a.getId().equals(alertId))
                .findFirst();
        if (alert.isEmpty()) {
            LOG.warn("Cannot acknowledge alert {}: not tracked", alertId);
            return false;
        }
        alert.get().acknowledge(clock.instant());
        return true;
    }

    /** @return number of alerts newly acknowledged */
    public synchronized int acknowledgeAll() {
        Instant now = clock.instant();
        int count = 0;
        for (AnomalyAlert a : trackedAlerts()) {
            if (a.acknowledge(now)) {
                count++;
            }
        }
        return count;
    }

    private List<AnomalyAlert> trackedAlerts() {
        List<AnomalyAlert> all = new ArrayList<>();
        recentAlerts.entries().values().forEach(all::addAll);
        return all;
    }

    public synchronized AlertStats getStats() {
        Map<AlertLevel, Integer> byLevel = new EnumMap<>(AlertLevel.class);
        for (AlertLevel level : AlertLevel.values()) {
            byLevel.put(level, 0);
        }
        Map<String, Integer> byType = new TreeMap<>();
        int total = 0;
        int acknowledged = 0;
        for (AnomalyAlert a : trackedAlerts()) {
            total++;
            byLevel.merge(a.getLevel(), 1, Integer::sum);
            byType.merge(a.getTitle().split(" ", 2)[0], 1, Integer::sum);
            if (a.isAcknowledged()) {
                acknowledged++;
            }
        }
        int converged = convergenceGroups.entries().values().stream()
                .mapToInt(g -> Math.max(0, g.getCount() - 1))
                .sum();
        return new AlertStats(total, byLevel, byType, acknowledged, total - acknowledged, converged);
    }

    /** @return live convergence groups with more than one alert, largest first */
    public synchronized List<ConvergenceGroup> getConvergenceSummary() {
        return convergenceGroups.entries().values().stream()
                .filter(g -> g.getCount() > 1)
                .sorted(Comparator.comparingInt(ConvergenceGroup::getCount).reversed())
                .collect(Collectors.toList());
    }

    /**
     * Drop alerts older than twice the deduplication window, idle convergence
     * groups and elapsed cooldowns.
     */
    public synchronized void cleanup() {
        Instant cutoff = clock.instant().minus(config.get().getDeduplicationWindow().multipliedBy(2));
        int prunedAlerts = 0;
        for (Map.Entry<String, List<AnomalyAlert>> e : recentAlerts.entries().entrySet()) {
            List<AnomalyAlert> alerts = e.getValue();
            int before = alerts.size();
            alerts.removeIf(a -> !a.getCreatedAt().isAfter(cutoff));
            prunedAlerts += before - alerts.size();
            if (alerts.isEmpty()) {
                recentAlerts.remove(e.getKey());
            }
        }
        int expired = recentAlerts.purgeExpired() + convergenceGroups.purgeExpired() + cooldownUntil.purgeExpired();
        LOG.debug("Alert cleanup: pruned {} alerts, dropped {} expired entries", prunedAlerts, expired);
    }

    // -------------------------------------------------------------------------
    // Configuration
    // -------------------------------------------------------------------------

    /** Swap the policy; applies from the next call on. */
    public void updateConfig(AlertConfig newConfig) {
        Objects.requireNonNull(newConfig, "config must not be null");
        AlertConfig old = config.getAndSet(newConfig);
        LOG.info("Alert config updated: {} -> {}", old, newConfig);
    }

    public AlertConfig getConfig() {
        return config.get();
    }
}
