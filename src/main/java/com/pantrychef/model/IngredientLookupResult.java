package com.pantrychef.model;

import lombok.Value;

/**
 * Outcome of looking up one parsed ingredient. Immutable, one per input of a fan-out batch.
 */
@Value
public class IngredientLookupResult {

    public enum Outcome {
        RESOLVED,
        FAILED,
        SKIPPED
    }

    ParsedIngredient ingredient;
    IngredientInformation information;
    Outcome outcome;

    public static IngredientLookupResult resolved(ParsedIngredient ingredient, IngredientInformation information) {
        return new IngredientLookupResult(ingredient, information, Outcome.RESOLVED);
    }

    public static IngredientLookupResult failed(ParsedIngredient ingredient) {
        return new IngredientLookupResult(ingredient, null, Outcome.FAILED);
    }

    public static IngredientLookupResult skipped(ParsedIngredient ingredient) {
        return new IngredientLookupResult(ingredient, null, Outcome.SKIPPED);
    }

    public boolean isPresent() {
        return outcome == Outcome.RESOLVED && information != null;
    }
}
