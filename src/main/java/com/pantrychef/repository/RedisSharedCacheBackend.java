package com.pantrychef.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantrychef.cache.CacheBackendException;
import com.pantrychef.cache.SharedCacheBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed shared cache tier with compression.
 *
 * Values are stored as GZIP-compressed JSON under the caller's namespaced key
 * ({@code recipe:*}, {@code inginfo:*}). Counters ({@code rl:*}) are plain Redis integers.
 */
@Slf4j
public class RedisSharedCacheBackend implements SharedCacheBackend {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisSharedCacheBackend(RedisTemplate<String, byte[]> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            byte[] compressed = redisTemplate.opsForValue().get(key);
            if (compressed == null) {
                return Optional.empty();
            }
            return Optional.of(decompress(compressed, type));
        } catch (Exception e) {
            throw new CacheBackendException("Redis GET failed for " + key, e);
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        try {
            byte[] compressed = compress(value);
            redisTemplate.opsForValue().set(key, compressed, ttl);
            log.debug("Stored in Redis: key={}, ttl={}, size={}B", key, ttl, compressed.length);
        } catch (Exception e) {
            throw new CacheBackendException("Redis SET failed for " + key, e);
        }
    }

    @Override
    public long increment(String key, Duration ttlOnCreate) {
        try {
            Long count = redisTemplate.opsForValue().increment(key);
            if (count == null) {
                throw new IllegalStateException("INCR returned no value (pipeline or transaction active?)");
            }
            if (count == 1L) {
                redisTemplate.expire(key, ttlOnCreate);
            }
            return count;
        } catch (Exception e) {
            throw new CacheBackendException("Redis INCR failed for " + key, e);
        }
    }

    @Override
    public Optional<Duration> getExpire(String key) {
        try {
            Long seconds = redisTemplate.getExpire(key, TimeUnit.SECONDS);
            // -1 means no expiry, -2 means missing key
            if (seconds == null || seconds < 0) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofSeconds(seconds));
        } catch (Exception e) {
            throw new CacheBackendException("Redis TTL failed for " + key, e);
        }
    }

    private byte[] compress(Object value) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {

            gzipOut.write(objectMapper.writeValueAsBytes(value));
            gzipOut.finish();

            return baos.toByteArray();
        }
    }

    private <T> T decompress(byte[] compressed, Class<T> type) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), type);
        }
    }
}
