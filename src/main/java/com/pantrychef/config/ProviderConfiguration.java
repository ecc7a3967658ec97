package com.pantrychef.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantrychef.provider.DisabledNutritionLookupService;
import com.pantrychef.provider.GenerationService;
import com.pantrychef.provider.MockGenerationService;
import com.pantrychef.provider.NutritionLookupService;
import com.pantrychef.provider.OpenAIGenerationService;
import com.pantrychef.provider.SpoonacularLookupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the generation and nutrition lookup implementations once, at startup.
 */
@Slf4j
@Configuration
public class ProviderConfiguration {

    private final PantryChefProperties properties;

    public ProviderConfiguration(PantryChefProperties properties) {
        this.properties = properties;
    }

    @Bean
    public GenerationService generationService(
            @Qualifier(WebClientConfiguration.GENERATION_CLIENT) WebClient webClient,
            ObjectMapper objectMapper) {
        if (properties.getGeneration().isMock()) {
            log.info("Generation running in mock mode");
            return new MockGenerationService(new ClassPathResource("mock/recipes.json"));
        }

        OpenAIGenerationService service = new OpenAIGenerationService(webClient, objectMapper, properties.getGeneration());
        if (!service.isConfigured()) {
            log.warn("OpenAI API key missing; generation requests will fail until it is set");
        }
        return service;
    }

    @Bean
    public NutritionLookupService nutritionLookupService(
            @Qualifier(WebClientConfiguration.ENRICHMENT_CLIENT) WebClient webClient) {
        PantryChefProperties.EnrichmentConfig enrichment = properties.getEnrichment();
        if (!StringUtils.hasText(enrichment.getApiKey())) {
            log.info("No nutrition lookup key configured; recipes will carry generator estimates");
            return new DisabledNutritionLookupService();
        }

        log.info("Nutrition enrichment via Spoonacular, concurrency={}", enrichment.getConcurrency());
        return new SpoonacularLookupService(webClient, enrichment);
    }
}
