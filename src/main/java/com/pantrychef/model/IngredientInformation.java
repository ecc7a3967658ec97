package com.pantrychef.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Nutrition facts for one ingredient at a given amount, as returned by the lookup service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngredientInformation {

    private String id;

    private String name;

    private Double amount;

    private String unit;

    private Nutrition nutrition;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Nutrition {

        @Builder.Default
        private List<Nutrient> nutrients = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Nutrient {

        /**
         * Free-form nutrient name ("Calories", "Net Carbohydrates", ...). No fixed vocabulary.
         */
        @JsonAlias("title")
        private String name;

        private Double amount;

        private String unit;
    }
}
