package com.pantrychef.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Macronutrients in grams, as estimated by the generator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Macros {

    private double protein;

    private double carbs;

    private double fat;
}
