package com.qualitysentinel.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ExpiringCache} backed by a {@link ConcurrentHashMap}. Expiry is
 * judged against the injected {@link Clock}.
 *
 * @since 1.0.0
 */
public class InMemoryExpiringCache<K, V> implements ExpiringCache<K, V> {

    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryExpiringCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        putUntil(key, value, clock.instant().plus(ttl));
    }

    @Override
    public void putUntil(K key, V value, Instant expiresAt) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        entries.put(key, new Entry<>(value, expiresAt));
    }

    @Override
    public Optional<V> get(K key) {
        return live(key).map(e -> e.value);
    }

    @Override
    public Optional<Instant> expiryOf(K key) {
        return live(key).map(e -> e.expiresAt);
    }

    private Optional<Entry<V>> live(K key) {
        Entry<V> e = entries.get(key);
        if (e == null || e.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(e);
    }

    @Override
    public Map<K, V> entries() {
        Instant now = clock.instant();
        Map<K, V> out = new LinkedHashMap<>();
        entries.forEach((k, e) -> {
            if (!e.isExpired(now)) {
                out.put(k, e.value);
            }
        });
        return out;
    }

    @Override
    public boolean remove(K key) {
        Entry<V> removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now));
        return before - entries.size();
    }

    @Override
    public int size() {
        Instant now = clock.instant();
        return (int) entries.values().stream().filter(e -> !e.isExpired(now)).count();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    private static final class Entry<V> {

        private final V value;
        private final Instant expiresAt;

        Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
