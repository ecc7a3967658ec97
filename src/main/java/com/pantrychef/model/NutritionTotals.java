package com.pantrychef.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rounded nutrition values: kcal and grams.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NutritionTotals {

    private long calories;

    private long protein;

    private long carbs;

    private long fat;
}
