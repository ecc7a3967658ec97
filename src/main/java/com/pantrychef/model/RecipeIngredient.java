package com.pantrychef.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ingredient line of a generated recipe, e.g. {@code {name: "brown rice", quantity: "1 cup"}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeIngredient {

    private String name;

    private String quantity;
}
