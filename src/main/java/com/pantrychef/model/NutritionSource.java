package com.pantrychef.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a recipe's nutrition numbers came from.
 */
public enum NutritionSource {

    /**
     * Summed from per-ingredient lookups.
     */
    ENRICHED("enriched"),

    /**
     * Generator-supplied estimate, used when lookups yielded nothing usable.
     */
    ESTIMATED("estimated");

    private final String value;

    NutritionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
