package com.pantrychef.cache;

import com.pantrychef.config.PantryChefProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Two-tier cache: a fast local tier in front of an optional shared tier.
 *
 * Flow:
 * 1. Read local; on hit return
 * 2. On miss read shared (if enabled); on hit repopulate local with the remaining TTL
 * 3. Writes go to local always, to shared when enabled
 *
 * Shared-tier failures are logged and swallowed.
 */
@Slf4j
@Component
public class TieredCacheStore implements CacheStore {

    private final LocalCacheTier local;
    private final SharedCacheBackend shared;
    private final PantryChefProperties properties;

    public TieredCacheStore(LocalCacheTier local, SharedCacheBackend shared, PantryChefProperties properties) {
        this.local = local;
        this.shared = shared;
        this.properties = properties;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<Object> localValue = local.get(key);
        if (localValue.isPresent()) {
            if (type.isInstance(localValue.get())) {
                log.debug("Local cache hit: {}", key);
                return Optional.of(type.cast(localValue.get()));
            }
            log.warn("Local cache entry {} holds {}, expected {}; ignoring",
                    key, localValue.get().getClass().getSimpleName(), type.getSimpleName());
        }

        if (!shared.isEnabled()) {
            log.debug("Cache miss: {}", key);
            return Optional.empty();
        }

        Optional<T> sharedValue;
        try {
            sharedValue = shared.get(key, type);
        } catch (CacheBackendException e) {
            log.warn("Shared cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }

        if (sharedValue.isEmpty()) {
            log.debug("Cache miss: {}", key);
            return sharedValue;
        }

        Duration ttl = remainingSharedTtl(key);
        local.put(key, sharedValue.get(), ttl);
        log.debug("Shared cache hit: {}, repopulated local tier for {}", key, ttl);
        return sharedValue;
    }

    /**
     * Remaining TTL of a shared entry, or the default TTL when it cannot be read.
     */
    private Duration remainingSharedTtl(String key) {
        Duration fallback = properties.getCache().getDefaultTtl();
        try {
            return shared.getExpire(key)
                    .filter(remaining -> !remaining.isZero() && !remaining.isNegative())
                    .orElse(fallback);
        } catch (CacheBackendException e) {
            log.warn("Shared cache TTL read failed for {}, using {}: {}", key, fallback, e.getMessage());
            return fallback;
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        local.put(key, value, ttl);

        if (!shared.isEnabled()) {
            return;
        }

        try {
            shared.set(key, value, ttl);
        } catch (CacheBackendException e) {
            log.warn("Shared cache write failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public long increment(String key, Duration ttl) {
        if (shared.isEnabled()) {
            try {
                return shared.increment(key, ttl);
            } catch (CacheBackendException e) {
                log.warn("Shared counter increment failed for {}, counting locally: {}", key, e.getMessage());
            }
        }
        return local.increment(key, ttl);
    }

    @Override
    public boolean isShared() {
        return shared.isEnabled();
    }
}
