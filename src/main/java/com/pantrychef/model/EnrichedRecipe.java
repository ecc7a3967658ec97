package com.pantrychef.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Generated recipe annotated with normalized nutrition. This is what callers receive and what
 * the recipe-level cache stores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedRecipe {

    private String title;

    private String description;

    @Builder.Default
    private List<RecipeIngredient> ingredients = new ArrayList<>();

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    private double estimatedCalories;

    private Macros macros;

    private RecipeNutrition nutrition;

    private Provenance provenance;

    /**
     * Lookup-side decomposition of the ingredient lines; empty when enrichment did not run.
     */
    @Builder.Default
    private List<ParsedIngredient> parsedIngredients = new ArrayList<>();
}
