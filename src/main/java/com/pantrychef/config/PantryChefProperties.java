package com.pantrychef.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for PantryChef.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pantrychef")
public class PantryChefProperties {

    private GenerationConfig generation = new GenerationConfig();
    private EnrichmentConfig enrichment = new EnrichmentConfig();
    private CacheConfig cache = new CacheConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();

    @Data
    public static class GenerationConfig {
        /**
         * Serve canned recipes instead of calling the generation endpoint.
         */
        private boolean mock = false;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private int maxTokens = 1200;
        private int maxRecipes = 3;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class EnrichmentConfig {
        private String baseUrl = "https://api.spoonacular.com";
        private String apiKey;
        private int concurrency = 5;
        private Duration lookupTimeout = Duration.ofSeconds(10);
        private Duration successTtl = Duration.ofHours(24);
        private Duration failureTtl = Duration.ofSeconds(60);
    }

    @Data
    public static class CacheConfig {
        private Duration defaultTtl = Duration.ofHours(24);
        private Duration recipeTtl = Duration.ofHours(6);
        private SharedConfig shared = new SharedConfig();
    }

    @Data
    public static class SharedConfig {
        private boolean enabled = false;
        private String host = "localhost";
        private int port = 6379;
        private String password;
        private boolean ssl = false;
        private Duration commandTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class RateLimitConfig {
        private int perDay = 50;
    }
}
