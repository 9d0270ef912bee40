package com.qualitysentinel.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value map whose entries carry an expiry instant.
 *
 * <p>
 * An entry is live while the cache's clock has not passed its expiry.
 * Expired entries are invisible to every read but keep their memory until
 * {@link #purgeExpired()} runs.
 * </p>
 *
 * @param <K> key type
 * @param <V> value type
 * @since 1.0.0
 */
public interface ExpiringCache<K, V> {

    /**
     * Store a value, replacing any previous entry and its expiry.
     *
     * @param ttl time to live from now; must be positive
     */
    void put(K key, V value, Duration ttl);

    /** Store a value that expires at a fixed instant. */
    void putUntil(K key, V value, Instant expiresAt);

    Optional<V> get(K key);

    /** @return expiry of the live entry under {@code key} */
    Optional<Instant> expiryOf(K key);

    /** @return snapshot of all live entries */
    Map<K, V> entries();

    /** @return {@code true} if a live entry was removed */
    boolean remove(K key);

    /**
     * Physically drop expired entries.
     *
     * @return number of entries dropped
     */
    int purgeExpired();

    /** @return number of live entries */
    int size();

    void clear();
}
