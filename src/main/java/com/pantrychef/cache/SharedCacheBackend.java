package com.pantrychef.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Network-backed cache tier shared across processes.
 * All operations may throw {@link CacheBackendException}.
 */
public interface SharedCacheBackend {

    /**
     * @return true if this backend is reachable configuration-wise
     */
    boolean isEnabled();

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, Duration ttl);

    /**
     * INCR the key; applies {@code ttlOnCreate} when the increment created it.
     */
    long increment(String key, Duration ttlOnCreate);

    /**
     * @return remaining time to live, empty if the key has none or does not exist
     */
    Optional<Duration> getExpire(String key);
}
