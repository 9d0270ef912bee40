package com.qualitysentinel.core.storage;

import com.qualitysentinel.core.baseline.BaselineRecord;
import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyAlert;
import com.qualitysentinel.core.model.HealthScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorator that bounds every call on a delegate store by a timeout.
 *
 * <p>
 * Calls run on an owned worker pool. When a call does not finish in time the
 * worker is interrupted and {@link PersistenceException} is thrown. Runtime
 * failures of the delegate are rethrown as they are when they already are
 * {@link PersistenceException}, and wrapped otherwise.
 * </p>
 *
 * <p>
 * {@link #close()} shuts the pool down; the delegate is not closed.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeLimitedAnomalyStore implements AnomalyStore, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TimeLimitedAnomalyStore.class);

    private final AnomalyStore delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeLimitedAnomalyStore(AnomalyStore delegate, Duration timeout, int threads) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
        }
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "anomaly-store-io");
            t.setDaemon(true);
            return t;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }

    <T> T call(String operation, Callable<T> action) {
        Future<T> future = executor.submit(action);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.error("Store operation '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new PersistenceException("Store operation '" + operation + "' timed out after "
                    + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PersistenceException("Interrupted during store operation '" + operation + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PersistenceException pe) {
                throw pe;
            }
            throw new PersistenceException("Store operation '" + operation + "' failed", cause);
        }
    }

    private void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    @Override
    public Optional<BaselineRecord> getBaseline(String metricName) {
        return call("getBaseline", () -> delegate.getBaseline(metricName));
    }

    @Override
    public void saveBaseline(BaselineRecord record) {
        run("saveBaseline", () -> delegate.saveBaseline(record));
    }

    @Override
    public List<BaselineRecord> getAllBaselines() {
        return call("getAllBaselines", delegate::getAllBaselines);
    }

    @Override
    public boolean deleteBaseline(String metricName) {
        return call("deleteBaseline", () -> delegate.deleteBaseline(metricName));
    }

    @Override
    public void saveAnomaly(Anomaly anomaly) {
        run("saveAnomaly", () -> delegate.saveAnomaly(anomaly));
    }

    @Override
    public Optional<Anomaly> getAnomaly(String id) {
        return call("getAnomaly", () -> delegate.getAnomaly(id));
    }

    @Override
    public List<Anomaly> getAllAnomalies() {
        return call("getAllAnomalies", delegate::getAllAnomalies);
    }

    @Override
    public List<Anomaly> getActiveAnomalies() {
        return call("getActiveAnomalies", delegate::getActiveAnomalies);
    }

    @Override
    public List<Anomaly> getAnomaliesByMetric(String metricName) {
        return call("getAnomaliesByMetric", () -> delegate.getAnomaliesByMetric(metricName));
    }

    @Override
    public List<Anomaly> getAnomaliesBetween(Instant from, Instant to) {
        return call("getAnomaliesBetween", () -> delegate.getAnomaliesBetween(from, to));
    }

    @Override
    public List<Anomaly> getRecentAnomalies(int limit) {
        return call("getRecentAnomalies", () -> delegate.getRecentAnomalies(limit));
    }

    @Override
    public boolean deleteAnomaly(String id) {
        return call("deleteAnomaly", () -> delegate.deleteAnomaly(id));
    }

    @Override
    public int deleteResolvedBefore(Instant cutoff) {
        return call("deleteResolvedBefore", () -> delegate.deleteResolvedBefore(cutoff));
    }

    @Override
    public void clearAnomalies() {
        run("clearAnomalies", delegate::clearAnomalies);
    }

    @Override
    public void saveHealthScore(HealthScore score) {
        run("saveHealthScore", () -> delegate.saveHealthScore(score));
    }

    @Override
    public Optional<HealthScore> getLatestHealthScore() {
        return call("getLatestHealthScore", delegate::getLatestHealthScore);
    }

    @Override
    public List<HealthScore> getRecentHealthScores(int limit) {
        return call("getRecentHealthScores", () -> delegate.getRecentHealthScores(limit));
    }

    @Override
    public void saveAlert(AnomalyAlert alert) {
        run("saveAlert", () -> delegate.saveAlert(alert));
    }

    @Override
    public Optional<AnomalyAlert> getAlert(String id) {
        return call("getAlert", () -> delegate.getAlert(id));
    }

    @Override
    public List<AnomalyAlert> getRecentAlerts(int limit) {
        return call("getRecentAlerts", () -> delegate.getRecentAlerts(limit));
    }

    @Override
    public int deleteAlertsBefore(Instant cutoff) {
        return call("deleteAlertsBefore", () -> delegate.deleteAlertsBefore(cutoff));
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
