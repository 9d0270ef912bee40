package com.qualitysentinel.core.cache;

import com.qualitysentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryExpiringCache}.
 */
class InMemoryExpiringCacheTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryExpiringCache<String, Integer> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        cache = new InMemoryExpiringCache<>(clock);
    }

    @Test
    @DisplayName("Entries stay visible up to and including their expiry instant")
    void shouldExpireStrictlyAfterDeadline() {
        cache.put("a", 1, Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(10));
        assertThat(cache.get("a")).contains(1);
        assertThat(cache.expiryOf("a")).contains(NOW.plusSeconds(10));

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Purging reclaims only expired entries")
    void shouldPurgeExpired() {
        cache.put("short", 1, Duration.ofSeconds(1));
        cache.put("long", 2, Duration.ofMinutes(5));
        cache.putUntil("past", 3, NOW.minusSeconds(1));

        clock.advance(Duration.ofSeconds(2));

        assertThat(cache.purgeExpired()).isEqualTo(2);
        assertThat(cache.entries()).containsOnlyKeys("long");
    }

    @Test
    @DisplayName("Removing an expired entry reports false")
    void shouldNotReportExpiredRemoval() {
        cache.put("a", 1, Duration.ofSeconds(1));
        cache.put("b", 2, Duration.ofSeconds(1));
        assertThat(cache.remove("a")).isTrue();

        clock.advance(Duration.ofSeconds(5));
        assertThat(cache.remove("b")).isFalse();
        assertThat(cache.remove("missing")).isFalse();
    }

    @Test
    @DisplayName("Non-positive TTLs are rejected")
    void shouldRejectNonPositiveTtl() {
        assertThatThrownBy(() -> cache.put("a", 1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ttl must be positive");
    }
}
