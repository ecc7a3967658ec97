package com.pantrychef.service.nutrition;

import com.pantrychef.model.CandidateRecipe;
import com.pantrychef.model.EnrichedRecipe;
import com.pantrychef.model.IngredientInformation;
import com.pantrychef.model.IngredientLookupResult;
import com.pantrychef.model.Macros;
import com.pantrychef.model.NutritionSource;
import com.pantrychef.model.ParsedIngredient;
import com.pantrychef.model.Provenance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NutritionAggregator.
 */
class NutritionAggregatorTest {

    private NutritionAggregator aggregator;
    private CandidateRecipe recipe;

    @BeforeEach
    void setUp() {
        aggregator = new NutritionAggregator();
        recipe = CandidateRecipe.builder()
                .title("Chickpea & Spinach Pilaf")
                .estimatedCalories(480)
                .macros(new Macros(22, 65, 12))
                .build();
    }

    private static IngredientLookupResult resolved(String id, IngredientInformation.Nutrient... nutrients) {
        ParsedIngredient ingredient = ParsedIngredient.builder().id(id).amount(1.0).unit("g").build();
        IngredientInformation information = IngredientInformation.builder()
                .id(id)
                .nutrition(IngredientInformation.Nutrition.builder().nutrients(List.of(nutrients)).build())
                .build();
        return IngredientLookupResult.resolved(ingredient, information);
    }

    private static IngredientLookupResult failed(String id) {
        return IngredientLookupResult.failed(ParsedIngredient.builder().id(id).amount(1.0).unit("g").build());
    }

    private static IngredientInformation.Nutrient nutrient(String name, double amount) {
        return IngredientInformation.Nutrient.builder().name(name).amount(amount).unit("g").build();
    }

    @Test
    void testPartialFailureStillEnriched() {
        List<IngredientLookupResult> results = List.of(
                resolved("1", nutrient("Calories", 210.4), nutrient("Protein", 11.6), nutrient("Carbohydrates", 35.2), nutrient("Fat", 3.3)),
                failed("2"),
                resolved("3", nutrient("Calories", 100.2), nutrient("Protein", 2.0)));

        EnrichedRecipe enriched = aggregator.aggregate(recipe, results, 1);

        assertEquals(NutritionSource.ENRICHED, enriched.getNutrition().getSource());
        assertEquals(Provenance.GENERATION_ENRICHMENT, enriched.getProvenance());
        assertEquals(311, enriched.getNutrition().getTotals().getCalories());
        assertEquals(14, enriched.getNutrition().getTotals().getProtein());
        assertEquals(35, enriched.getNutrition().getTotals().getCarbs());
        assertEquals(3, enriched.getNutrition().getTotals().getFat());
        assertEquals(3, enriched.getParsedIngredients().size());
    }

    @Test
    void testAllFailedFallsBackToEstimates() {
        EnrichedRecipe enriched = aggregator.aggregate(recipe, List.of(failed("1"), failed("2")), 2);

        assertEquals(NutritionSource.ESTIMATED, enriched.getNutrition().getSource());
        assertEquals(Provenance.GENERATION, enriched.getProvenance());
        assertEquals(480, enriched.getNutrition().getTotals().getCalories());
        assertEquals(240, enriched.getNutrition().getPerServing().getCalories());
        assertEquals(11, enriched.getNutrition().getPerServing().getProtein());
        assertEquals(33, enriched.getNutrition().getPerServing().getCarbs());
        assertEquals(6, enriched.getNutrition().getPerServing().getFat());
    }

    @Test
    void testNegativeSumsFallBackToEstimates() {
        List<IngredientLookupResult> results = List.of(resolved("1", nutrient("Calories", -40), nutrient("Fat", -2)));

        EnrichedRecipe enriched = aggregator.aggregate(recipe, results, 1);

        assertEquals(NutritionSource.ESTIMATED, enriched.getNutrition().getSource());
        assertEquals(Provenance.GENERATION, enriched.getProvenance());
        assertEquals(480, enriched.getNutrition().getTotals().getCalories());
    }

    @Test
    void testNoResultsFallsBackToEstimates() {
        EnrichedRecipe enriched = aggregator.aggregate(recipe, List.of(), 1);

        assertEquals(NutritionSource.ESTIMATED, enriched.getNutrition().getSource());
        assertTrue(enriched.getParsedIngredients().isEmpty());
    }

    @Test
    void testPerServingRoundsHalfUpFromRoundedTotal() {
        List<IngredientLookupResult> results = List.of(resolved("1", nutrient("Calories", 500.6)));

        EnrichedRecipe enriched = aggregator.aggregate(recipe, results, 3);

        assertEquals(501, enriched.getNutrition().getTotals().getCalories());
        assertEquals(167, enriched.getNutrition().getPerServing().getCalories());
    }

    @Test
    void testServingsBelowOneCountAsOne() {
        EnrichedRecipe enriched = aggregator.aggregate(recipe, List.of(), 0);

        assertEquals(480, enriched.getNutrition().getPerServing().getCalories());
    }

    @Test
    void testNutrientNamesMatchedBySubstring() {
        List<IngredientLookupResult> results = List.of(resolved("1",
                nutrient("calories", 100),
                nutrient("Saturated Fat", 2),
                nutrient("Fat", 5),
                nutrient("Net Carbohydrates", 10),
                nutrient("Vitamin C", 50)));

        EnrichedRecipe enriched = aggregator.aggregate(recipe, results, 1);

        assertEquals(100, enriched.getNutrition().getTotals().getCalories());
        assertEquals(7, enriched.getNutrition().getTotals().getFat());
        assertEquals(10, enriched.getNutrition().getTotals().getCarbs());
        assertEquals(0, enriched.getNutrition().getTotals().getProtein());
    }

    @Test
    void testCategoryOrderPrefersCalorie() {
        assertEquals(NutritionAggregator.Category.CALORIES, NutritionAggregator.Category.match("Calories from Fat"));
        assertEquals(NutritionAggregator.Category.CARBS, NutritionAggregator.Category.match("CARBOHYDRATES"));
        assertNull(NutritionAggregator.Category.match("Sodium"));
        assertNull(NutritionAggregator.Category.match(null));
    }

    @Test
    void testRecipeFieldsCarriedOver() {
        EnrichedRecipe enriched = aggregator.aggregate(recipe, List.of(), 1);

        assertEquals("Chickpea & Spinach Pilaf", enriched.getTitle());
        assertEquals(480, enriched.getEstimatedCalories());
        assertEquals(22, enriched.getMacros().getProtein());
    }
}
