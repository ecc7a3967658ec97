package com.pantrychef.config;

import com.pantrychef.cache.LocalCacheTier;
import com.pantrychef.cache.NoOpSharedCacheBackend;
import com.pantrychef.cache.SharedCacheBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Local cache tier and the shared-tier fallback used when Redis is not configured.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LocalCacheTier localCacheTier(Clock clock) {
        return new LocalCacheTier(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pantrychef.cache.shared", name = "enabled", havingValue = "false", matchIfMissing = true)
    public SharedCacheBackend noOpSharedCacheBackend() {
        log.info("Shared cache tier disabled; caches and rate counters are process-local");
        return new NoOpSharedCacheBackend();
    }
}
