package com.qualitysentinel.core.storage;

import com.qualitysentinel.core.model.Anomaly;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeLimitedAnomalyStore}.
 */
class TimeLimitedAnomalyStoreTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private TimeLimitedAnomalyStore store;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (store != null) {
            store.close();
        }
    }

    @Test
    @DisplayName("Calls within the timeout pass through")
    void shouldDelegate() {
        store = new TimeLimitedAnomalyStore(new InMemoryAnomalyStore(), Duration.ofSeconds(5), 1);

        assertThat(store.getAnomaly("missing")).isEmpty();
        assertThat(store.getTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("A slow call fails with PersistenceException")
    void shouldTimeOut() {
        store = new TimeLimitedAnomalyStore(new InMemoryAnomalyStore() {
            @Override
            public Optional<Anomaly> getAnomaly(String id) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Optional.empty();
            }
        }, Duration.ofMillis(50), 1);

        assertThatThrownBy(() -> store.getAnomaly("a1"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("timed out after 50 ms");
    }

    @Test
    @DisplayName("Delegate failures are wrapped, persistence failures pass through")
    void shouldWrapFailures() {
        store = new TimeLimitedAnomalyStore(new InMemoryAnomalyStore() {
            @Override
            public boolean deleteAnomaly(String id) {
                throw new IllegalStateException("disk full");
            }

            @Override
            public void clearAnomalies() {
                throw new PersistenceException("read-only");
            }
        }, Duration.ofSeconds(5), 1);

        assertThatThrownBy(() -> store.deleteAnomaly("a1"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("failed")
                .hasRootCauseMessage("disk full");
        assertThatThrownBy(() -> store.clearAnomalies())
                .isInstanceOf(PersistenceException.class)
                .hasMessage("read-only");
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new TimeLimitedAnomalyStore(new InMemoryAnomalyStore(), Duration.ZERO, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeLimitedAnomalyStore(new InMemoryAnomalyStore(), Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
