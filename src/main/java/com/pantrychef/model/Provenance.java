package com.pantrychef.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which stages contributed to a recipe.
 */
public enum Provenance {

    GENERATION("generation"),

    GENERATION_ENRICHMENT("generation+enrichment");

    private final String value;

    Provenance(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
