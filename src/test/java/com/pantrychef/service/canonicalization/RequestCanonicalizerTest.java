package com.pantrychef.service.canonicalization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantrychef.model.CacheKey;
import com.pantrychef.model.EnrichmentRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequestCanonicalizer.
 */
class RequestCanonicalizerTest {

    private RequestCanonicalizer canonicalizer;

    @BeforeEach
    void setUp() {
        canonicalizer = new RequestCanonicalizer(new ObjectMapper());
    }

    @Test
    void testIngredientOrderAndCaseDoNotMatter() {
        EnrichmentRequest a = EnrichmentRequest.builder()
                .ingredients(List.of("Chickpeas", "brown rice", "spinach"))
                .diet("vegetarian")
                .servings(2)
                .build();
        EnrichmentRequest b = EnrichmentRequest.builder()
                .ingredients(List.of("  spinach ", "CHICKPEAS", "Brown   Rice"))
                .diet(" Vegetarian ")
                .servings(2)
                .build();

        assertEquals(canonicalizer.canonicalize(a), canonicalizer.canonicalize(b));
    }

    @Test
    void testCanonicalFormIsSortedAndNormalized() {
        EnrichmentRequest request = EnrichmentRequest.builder()
                .ingredients(List.of("Spinach", "chickpeas"))
                .diet("Vegan")
                .servings(0)
                .build();

        assertEquals("{\"diet\":\"vegan\",\"ingredients\":[\"chickpeas\",\"spinach\"],\"servings\":1}",
                canonicalizer.canonicalForm(request));
    }

    @Test
    void testSpecialCharactersAreEscaped() {
        EnrichmentRequest request = EnrichmentRequest.builder()
                .ingredients(List.of("sun \"dried\" Tomato", "back\\slash"))
                .build();

        assertEquals("{\"diet\":\"none\",\"ingredients\":[\"back\\\\slash\",\"sun \\\"dried\\\" tomato\"],\"servings\":1}",
                canonicalizer.canonicalForm(request));
    }

    @Test
    void testDietAndServingsChangeTheKey() {
        EnrichmentRequest base = EnrichmentRequest.builder()
                .ingredients(List.of("rice"))
                .diet("none")
                .servings(2)
                .build();
        EnrichmentRequest otherDiet = EnrichmentRequest.builder()
                .ingredients(List.of("rice"))
                .diet("keto")
                .servings(2)
                .build();
        EnrichmentRequest otherServings = EnrichmentRequest.builder()
                .ingredients(List.of("rice"))
                .diet("none")
                .servings(4)
                .build();

        CacheKey key = canonicalizer.canonicalize(base);
        assertNotEquals(key, canonicalizer.canonicalize(otherDiet));
        assertNotEquals(key, canonicalizer.canonicalize(otherServings));
    }

    @Test
    void testProfileAndCalorieTargetAreIgnored() {
        EnrichmentRequest plain = EnrichmentRequest.builder()
                .ingredients(List.of("rice"))
                .build();
        EnrichmentRequest withProfile = EnrichmentRequest.builder()
                .ingredients(List.of("rice"))
                .calorieTarget(1800)
                .userProfile(Map.of("age", 34))
                .build();

        assertEquals(canonicalizer.canonicalize(plain), canonicalizer.canonicalize(withProfile));
    }

    @Test
    void testKeyIsSha256Hex() {
        CacheKey key = canonicalizer.canonicalize(EnrichmentRequest.builder().ingredients(List.of("egg")).build());

        assertTrue(key.getDigest().matches("[0-9a-f]{64}"));
        assertEquals("recipe:" + key.getDigest(), key.toRecipeKey());
    }
}
