package com.pantrychef.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeNutrition {

    private NutritionTotals totals;

    private NutritionTotals perServing;

    private NutritionSource source;
}
