package com.pantrychef.provider;

import com.pantrychef.config.PantryChefProperties;
import com.pantrychef.model.IngredientInformation;
import com.pantrychef.model.ParsedIngredient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Spoonacular nutrition lookups.
 *
 * Endpoints:
 * - POST /recipes/parseIngredients (form field ingredientList, newline separated)
 * - GET /food/ingredients/{id}/information?amount=&unit=
 */
@Slf4j
public class SpoonacularLookupService implements NutritionLookupService {

    private static final ParameterizedTypeReference<List<ParsedIngredient>> PARSED_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final PantryChefProperties.EnrichmentConfig config;

    public SpoonacularLookupService(WebClient webClient, PantryChefProperties.EnrichmentConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public String getName() {
        return "spoonacular";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Mono<List<ParsedIngredient>> parseIngredients(List<String> lines) {
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/recipes/parseIngredients")
                .queryParam("apiKey", config.getApiKey())
                .build()
                .encode()
                .toUri();

        return webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("ingredientList", String.join("\n", lines)))
                .retrieve()
                .bodyToMono(PARSED_LIST)
                .timeout(config.getLookupTimeout())
                .defaultIfEmpty(List.of())
                .doOnError(error -> log.warn("Spoonacular parseIngredients failed: {}", error.getMessage()));
    }

    @Override
    public Mono<IngredientInformation> resolve(ParsedIngredient ingredient) {
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/food/ingredients/{id}/information")
                .queryParam("apiKey", config.getApiKey())
                .queryParam("amount", ingredient.getAmount())
                .queryParam("unit", ingredient.getEffectiveUnit())
                .buildAndExpand(ingredient.getId())
                .encode()
                .toUri();

        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(IngredientInformation.class);
    }
}
