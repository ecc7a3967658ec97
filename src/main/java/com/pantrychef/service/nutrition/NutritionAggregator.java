package com.pantrychef.service.nutrition;

import com.pantrychef.model.CandidateRecipe;
import com.pantrychef.model.EnrichedRecipe;
import com.pantrychef.model.IngredientInformation;
import com.pantrychef.model.IngredientLookupResult;
import com.pantrychef.model.Macros;
import com.pantrychef.model.NutritionSource;
import com.pantrychef.model.NutritionTotals;
import com.pantrychef.model.ParsedIngredient;
import com.pantrychef.model.Provenance;
import com.pantrychef.model.RecipeNutrition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Folds per-ingredient lookups into recipe nutrition.
 *
 * Nutrient names are free-form, so categories are matched by case-insensitive substring, first
 * match wins in this order: "calorie", "protein", "fat", "carb". When the summed amounts are not
 * positive the generator's own estimate is used instead.
 */
@Slf4j
@Component
public class NutritionAggregator {

    enum Category {
        CALORIES("calorie"),
        PROTEIN("protein"),
        FAT("fat"),
        CARBS("carb");

        private final String needle;

        Category(String needle) {
            this.needle = needle;
        }

        static Category match(String nutrientName) {
            if (nutrientName == null) {
                return null;
            }
            String lower = nutrientName.toLowerCase(Locale.ROOT);
            for (Category category : values()) {
                if (lower.contains(category.needle)) {
                    return category;
                }
            }
            return null;
        }
    }

    /**
     * Build the enriched recipe.
     *
     * @param recipe   generated recipe
     * @param results  lookup results for its ingredients, absent ones are ignored
     * @param servings serving count, values below 1 count as 1
     * @return recipe with totals, per-serving values, source and provenance
     */
    public EnrichedRecipe aggregate(CandidateRecipe recipe, List<IngredientLookupResult> results, int servings) {
        double[] sums = new double[Category.values().length];

        for (IngredientLookupResult result : results) {
            if (!result.isPresent()) {
                continue;
            }
            IngredientInformation.Nutrition nutrition = result.getInformation().getNutrition();
            if (nutrition == null || nutrition.getNutrients() == null) {
                continue;
            }
            for (IngredientInformation.Nutrient nutrient : nutrition.getNutrients()) {
                Category category = Category.match(nutrient.getName());
                if (category != null && nutrient.getAmount() != null && Double.isFinite(nutrient.getAmount())) {
                    sums[category.ordinal()] += nutrient.getAmount();
                }
            }
        }

        double anyTotal = 0;
        for (double sum : sums) {
            anyTotal += sum;
        }

        NutritionSource source;
        NutritionTotals totals;
        if (anyTotal <= 0) {
            Macros macros = recipe.getMacros() == null ? new Macros() : recipe.getMacros();
            totals = totals(recipe.getEstimatedCalories(), macros.getProtein(), macros.getCarbs(), macros.getFat());
            source = NutritionSource.ESTIMATED;
        } else {
            totals = totals(
                    sums[Category.CALORIES.ordinal()],
                    sums[Category.PROTEIN.ordinal()],
                    sums[Category.CARBS.ordinal()],
                    sums[Category.FAT.ordinal()]);
            source = NutritionSource.ENRICHED;
        }

        int divisor = Math.max(1, servings);
        NutritionTotals perServing = NutritionTotals.builder()
                .calories(perServing(totals.getCalories(), divisor))
                .protein(perServing(totals.getProtein(), divisor))
                .carbs(perServing(totals.getCarbs(), divisor))
                .fat(perServing(totals.getFat(), divisor))
                .build();

        log.debug("Aggregated '{}': source={}, totals={}", recipe.getTitle(), source, totals);

        return EnrichedRecipe.builder()
                .title(recipe.getTitle())
                .description(recipe.getDescription())
                .ingredients(new ArrayList<>(recipe.getIngredients()))
                .steps(new ArrayList<>(recipe.getSteps()))
                .estimatedCalories(recipe.getEstimatedCalories())
                .macros(recipe.getMacros())
                .nutrition(RecipeNutrition.builder()
                        .totals(totals)
                        .perServing(perServing)
                        .source(source)
                        .build())
                .provenance(source == NutritionSource.ENRICHED ? Provenance.GENERATION_ENRICHMENT : Provenance.GENERATION)
                .parsedIngredients(parsedIngredients(results))
                .build();
    }

    private NutritionTotals totals(double calories, double protein, double carbs, double fat) {
        return NutritionTotals.builder()
                .calories(round(calories))
                .protein(round(protein))
                .carbs(round(carbs))
                .fat(round(fat))
                .build();
    }

    private List<ParsedIngredient> parsedIngredients(List<IngredientLookupResult> results) {
        List<ParsedIngredient> parsed = new ArrayList<>(results.size());
        for (IngredientLookupResult result : results) {
            parsed.add(result.getIngredient());
        }
        return parsed;
    }

    /**
     * Half-up rounding, clamped at zero.
     */
    private static long round(double value) {
        if (!Double.isFinite(value) || value <= 0) {
            return 0L;
        }
        return Math.round(value);
    }

    private static long perServing(long total, int servings) {
        return round((double) total / servings);
    }
}
