package com.pantrychef.provider;

import com.pantrychef.model.IngredientInformation;
import com.pantrychef.model.ParsedIngredient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Selected when no lookup API key is configured. Recipes keep generator estimates.
 */
public class DisabledNutritionLookupService implements NutritionLookupService {

    @Override
    public String getName() {
        return "disabled";
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public Mono<List<ParsedIngredient>> parseIngredients(List<String> lines) {
        return Mono.just(List.of());
    }

    @Override
    public Mono<IngredientInformation> resolve(ParsedIngredient ingredient) {
        return Mono.error(new IllegalStateException("Nutrition lookup is not configured"));
    }
}
