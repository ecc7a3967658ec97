package com.pantrychef.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantrychef.cache.SharedCacheBackend;
import com.pantrychef.repository.RedisSharedCacheBackend;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis configuration for the shared cache tier. Only active when
 * {@code pantrychef.cache.shared.enabled=true}; otherwise the no-op backend from
 * {@link CacheConfiguration} is used and all caching stays process-local.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "pantrychef.cache.shared", name = "enabled", havingValue = "true")
public class RedisConfiguration {

    private final PantryChefProperties properties;

    public RedisConfiguration(PantryChefProperties properties) {
        this.properties = properties;
    }

    /**
     * Configure Redis connection factory with timeouts and resilience.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        PantryChefProperties.SharedConfig shared = properties.getCache().getShared();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(shared.getHost(), shared.getPort());
        if (StringUtils.hasText(shared.getPassword())) {
            server.setPassword(shared.getPassword());
        }

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(10))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(shared.getCommandTimeout()))
                .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(shared.getCommandTimeout());
        if (shared.isSsl()) {
            clientConfig.useSsl();
        }

        LettuceConnectionFactory factory = new LettuceConnectionFactory(server, clientConfig.build());

        log.info("Configured shared cache connection to {}:{}", shared.getHost(), shared.getPort());
        return factory;
    }

    /**
     * Redis template for byte array storage (compressed cache entries).
     */
    @Bean
    public RedisTemplate<String, byte[]> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(RedisSerializer.byteArray());

        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public SharedCacheBackend sharedCacheBackend(RedisTemplate<String, byte[]> redisTemplate, ObjectMapper objectMapper) {
        return new RedisSharedCacheBackend(redisTemplate, objectMapper);
    }
}
