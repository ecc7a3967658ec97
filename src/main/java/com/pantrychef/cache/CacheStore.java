package com.pantrychef.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry TTL.
 *
 * Implementations never propagate backend failures: the cache is an optimization, so a
 * failing tier degrades to a miss on read and to a local-only write on store.
 */
public interface CacheStore {

    /**
     * Look up a value.
     *
     * @param key  namespaced cache key
     * @param type expected payload type
     * @return the value if present, unexpired and of the expected type
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Store a value, overwriting any previous value at the same key.
     *
     * @param key   namespaced cache key
     * @param value payload (must be JSON serializable for the shared tier)
     * @param ttl   time to live
     */
    void set(String key, Object value, Duration ttl);

    /**
     * Atomically increment a counter, starting at 1 with the given TTL when the key is absent.
     *
     * @return the counter value after incrementing
     */
    long increment(String key, Duration ttl);

    /**
     * @return true when a shared tier is configured
     */
    boolean isShared();
}
