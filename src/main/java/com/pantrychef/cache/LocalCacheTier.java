package com.pantrychef.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-local cache tier on Caffeine with per-entry expiry.
 *
 * Entries carry an absolute {@code expiresAt} taken from the injected clock. Caffeine evicts
 * them in the background; reads additionally check the clock so an entry is never served
 * once it has expired, even if eviction has not run yet.
 */
@Slf4j
public class LocalCacheTier {

    private final Clock clock;
    private final Cache<String, CacheEntry> entries;

    public LocalCacheTier(Clock clock) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .expireAfter(new Expiry<String, CacheEntry>() {
                    @Override
                    public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
                        return remainingNanos(entry);
                    }

                    @Override
                    public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
                        return remainingNanos(entry);
                    }

                    @Override
                    public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    public Optional<Object> get(String key) {
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }

        if (entry.isExpired(clock.instant())) {
            entries.asMap().remove(key, entry);
            log.debug("Local cache entry expired: {}", key);
            return Optional.empty();
        }

        return Optional.ofNullable(entry.getValue());
    }

    public void put(String key, Object value, Duration ttl) {
        entries.put(key, new CacheEntry(value, clock.instant().plus(ttl)));
    }

    /**
     * Increment a counter atomically. An absent, expired or non-numeric entry restarts at 1
     * with a fresh TTL; otherwise the existing expiry is kept.
     */
    public long increment(String key, Duration ttl) {
        CacheEntry updated = entries.asMap().compute(key, (k, current) -> {
            Instant now = clock.instant();
            if (current == null || current.isExpired(now) || !(current.getValue() instanceof Long)) {
                return new CacheEntry(1L, now.plus(ttl));
            }
            return new CacheEntry((Long) current.getValue() + 1, current.getExpiresAt());
        });
        return (Long) updated.getValue();
    }

    private long remainingNanos(CacheEntry entry) {
        Duration remaining = Duration.between(clock.instant(), entry.getExpiresAt());
        if (remaining.isNegative()) {
            return 0L;
        }
        try {
            return remaining.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
