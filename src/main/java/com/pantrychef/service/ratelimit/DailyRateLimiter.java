package com.pantrychef.service.ratelimit;

import com.pantrychef.cache.CacheStore;
import com.pantrychef.config.PantryChefProperties;
import com.pantrychef.model.RateLimitDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Per-identity daily request counter.
 *
 * Key pattern: rl:{identity}:{yyyy-MM-dd UTC}. The bucket lives 24h from its first request, so
 * rollover happens through expiry and the date in the key. Counting is atomic on the shared
 * tier; without one (or when it fails) counts are only correct within this process.
 *
 * The limiter never blocks or retries: exceeding the limit is reported to the caller.
 */
@Slf4j
@Service
public class DailyRateLimiter {

    private static final String KEY_PREFIX = "rl:";
    private static final String ANONYMOUS = "anon";
    private static final Duration BUCKET_TTL = Duration.ofHours(24);

    private final CacheStore cacheStore;
    private final PantryChefProperties properties;
    private final Clock clock;

    public DailyRateLimiter(CacheStore cacheStore, PantryChefProperties properties, Clock clock) {
        this.cacheStore = cacheStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Count one request for the identity and decide whether it is allowed.
     *
     * @param identity caller identity, blank means anonymous
     * @return decision with today's count including this request
     */
    public RateLimitDecision checkAndIncrement(String identity) {
        int limit = properties.getRateLimit().getPerDay();
        String key = bucketKey(identity);

        long count = cacheStore.increment(key, BUCKET_TTL);
        boolean allowed = count <= limit;

        if (!allowed) {
            log.info("Rate limit exceeded: key={}, count={}, limit={}", key, count, limit);
        } else {
            log.debug("Rate limit check: key={}, count={}, limit={}", key, count, limit);
        }

        return new RateLimitDecision(allowed, count, limit);
    }

    String bucketKey(String identity) {
        String subject = (identity == null || identity.isBlank()) ? ANONYMOUS : identity.trim();
        String day = LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(DateTimeFormatter.ISO_LOCAL_DATE);
        return KEY_PREFIX + subject + ":" + day;
    }
}
