package com.pantrychef.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Meal generation request: pantry ingredients plus user constraints.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrichmentRequest {

    @Builder.Default
    List<String> ingredients = List.of();

    @Builder.Default
    String diet = "none";

    /**
     * Daily calorie target, optional.
     */
    Integer calorieTarget;

    @Builder.Default
    Integer servings = 1;

    /**
     * Free-form profile (age, goals, allergies...) passed through to the prompt.
     */
    @Builder.Default
    Map<String, Object> userProfile = Map.of();

    /**
     * Servings clamped to at least 1.
     */
    @JsonIgnore
    public int getEffectiveServings() {
        return servings == null ? 1 : Math.max(1, servings);
    }
}
