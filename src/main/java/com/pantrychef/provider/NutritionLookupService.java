package com.pantrychef.provider;

import com.pantrychef.model.IngredientInformation;
import com.pantrychef.model.ParsedIngredient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Ingredient nutrition source: decomposes free-text ingredient lines and resolves nutrition
 * facts for one ingredient at a given amount.
 */
public interface NutritionLookupService {

    String getName();

    /**
     * @return false when no lookup source is configured; enrichment is then skipped
     */
    boolean isEnabled();

    /**
     * Decompose ingredient lines such as "1 cup brown rice".
     *
     * @param lines one ingredient per entry
     * @return parsed ingredients, one per recognized line
     */
    Mono<List<ParsedIngredient>> parseIngredients(List<String> lines);

    /**
     * Resolve nutrition facts for a parsed ingredient.
     *
     * @param ingredient resolvable ingredient (id and amount present)
     * @return nutrition facts, or an error
     */
    Mono<IngredientInformation> resolve(ParsedIngredient ingredient);
}
