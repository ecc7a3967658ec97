package com.pantrychef.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Recipe as produced by the generation stage, before enrichment.
 * Built leniently: missing or malformed fields are zero/empty, never null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateRecipe {

    @Builder.Default
    private String title = "";

    @Builder.Default
    private String description = "";

    @Builder.Default
    private List<RecipeIngredient> ingredients = new ArrayList<>();

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    private double estimatedCalories;

    @Builder.Default
    private Macros macros = new Macros();
}
