package com.pantrychef.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared tier used when no Redis is configured.
 */
public class NoOpSharedCacheBackend implements SharedCacheBackend {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        // nothing to write to
    }

    @Override
    public long increment(String key, Duration ttlOnCreate) {
        throw new CacheBackendException("Shared cache tier is not configured", null);
    }

    @Override
    public Optional<Duration> getExpire(String key) {
        return Optional.empty();
    }
}
