package com.pantrychef.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient configuration for the generation and nutrition lookup endpoints.
 */
@Configuration
public class WebClientConfiguration {

    public static final String GENERATION_CLIENT = "generationWebClient";
    public static final String ENRICHMENT_CLIENT = "enrichmentWebClient";

    private final PantryChefProperties properties;

    public WebClientConfiguration(PantryChefProperties properties) {
        this.properties = properties;
    }

    @Bean
    @Qualifier(GENERATION_CLIENT)
    public WebClient generationWebClient() {
        return buildClient(properties.getGeneration().getTimeout());
    }

    @Bean
    @Qualifier(ENRICHMENT_CLIENT)
    public WebClient enrichmentWebClient() {
        return buildClient(properties.getEnrichment().getLookupTimeout());
    }

    private WebClient buildClient(Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(responseTimeout);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
    }
}
