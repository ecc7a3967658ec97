package com.pantrychef.service.enrichment;

import com.pantrychef.cache.CacheStore;
import com.pantrychef.cache.LocalCacheTier;
import com.pantrychef.cache.NoOpSharedCacheBackend;
import com.pantrychef.cache.TieredCacheStore;
import com.pantrychef.config.PantryChefProperties;
import com.pantrychef.model.CandidateRecipe;
import com.pantrychef.model.IngredientInformation;
import com.pantrychef.model.IngredientLookupRecord;
import com.pantrychef.model.IngredientLookupResult;
import com.pantrychef.model.ParsedIngredient;
import com.pantrychef.model.RecipeIngredient;
import com.pantrychef.provider.NutritionLookupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class NutritionEnrichmentServiceTest {

    private NutritionLookupService lookupService;
    private PantryChefProperties properties;
    private CacheStore cacheStore;
    private NutritionEnrichmentService service;

    @BeforeEach
    void setUp() {
        lookupService = mock(NutritionLookupService.class);
        when(lookupService.isEnabled()).thenReturn(true);
        properties = new PantryChefProperties();
        cacheStore = new TieredCacheStore(new LocalCacheTier(Clock.systemUTC()), new NoOpSharedCacheBackend(), properties);
        service = new NutritionEnrichmentService(lookupService, cacheStore, properties);
    }

    private static ParsedIngredient ingredient(String id, double amount, String unit) {
        return ParsedIngredient.builder().id(id).amount(amount).unit(unit).name("item " + id).original(amount + " " + unit + " item " + id).build();
    }

    private static IngredientInformation info(String id, double calories) {
        return IngredientInformation.builder()
                .id(id)
                .nutrition(IngredientInformation.Nutrition.builder()
                        .nutrients(List.of(IngredientInformation.Nutrient.builder().name("Calories").amount(calories).unit("kcal").build()))
                        .build())
                .build();
    }

    @Test
    void testPartialFailureKeepsOrderAndNeverFailsBatch() {
        when(lookupService.resolve(any())).thenAnswer(inv -> {
            ParsedIngredient p = inv.getArgument(0);
            if ("2".equals(p.getId())) {
                return Mono.error(new IllegalStateException("HTTP 500"));
            }
            return Mono.just(info(p.getId(), 100));
        });

        List<IngredientLookupResult> results = service.enrich(List.of(
                ingredient("1", 100, "g"),
                ingredient("2", 50, "g"),
                ingredient("3", 1, "cup"))).block();

        assertNotNull(results);
        assertEquals(3, results.size());
        assertEquals("1", results.get(0).getIngredient().getId());
        assertEquals(IngredientLookupResult.Outcome.RESOLVED, results.get(0).getOutcome());
        assertEquals(IngredientLookupResult.Outcome.FAILED, results.get(1).getOutcome());
        assertFalse(results.get(1).isPresent());
        assertEquals(IngredientLookupResult.Outcome.RESOLVED, results.get(2).getOutcome());
    }

    @Test
    void testResultsFollowInputOrderDespiteCompletionOrder() {
        when(lookupService.resolve(any())).thenAnswer(inv -> {
            ParsedIngredient p = inv.getArgument(0);
            long delay = 200 - Long.parseLong(p.getId()) * 40;
            return Mono.delay(Duration.ofMillis(delay)).thenReturn(info(p.getId(), 10));
        });

        List<ParsedIngredient> input = List.of(
                ingredient("1", 1, "g"), ingredient("2", 1, "g"), ingredient("3", 1, "g"), ingredient("4", 1, "g"));

        List<IngredientLookupResult> results = service.enrich(input).block();

        assertNotNull(results);
        for (int i = 0; i < input.size(); i++) {
            assertEquals(input.get(i).getId(), results.get(i).getIngredient().getId());
            assertEquals(input.get(i).getId(), results.get(i).getInformation().getId());
        }
    }

    @Test
    void testConcurrencyBoundIsNeverExceeded() {
        properties.getEnrichment().setConcurrency(3);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();

        when(lookupService.resolve(any())).thenAnswer(inv -> {
            ParsedIngredient p = inv.getArgument(0);
            return Mono.defer(() -> {
                        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                        return Mono.delay(Duration.ofMillis(30)).map(tick -> {
                            inFlight.decrementAndGet();
                            return info(p.getId(), 10);
                        });
                    });
        });

        List<ParsedIngredient> input = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            input.add(ingredient(String.valueOf(i), 1, "g"));
        }

        List<IngredientLookupResult> results = service.enrich(input).block();

        assertNotNull(results);
        assertEquals(12, results.size());
        assertTrue(results.stream().allMatch(IngredientLookupResult::isPresent));
        assertTrue(maxInFlight.get() <= 3, "max in flight was " + maxInFlight.get());
        assertTrue(maxInFlight.get() >= 1);
    }

    @Test
    void testUnresolvableIngredientsAreSkippedWithoutLookup() {
        ParsedIngredient noId = ParsedIngredient.builder().amount(1.0).unit("g").original("salt").build();
        ParsedIngredient noAmount = ParsedIngredient.builder().id("9").amount(0.0).original("pepper to taste").build();

        List<IngredientLookupResult> results = service.enrich(List.of(noId, noAmount)).block();

        assertNotNull(results);
        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(r -> r.getOutcome() == IngredientLookupResult.Outcome.SKIPPED));
        verify(lookupService, never()).resolve(any());
    }

    @Test
    void testTimeoutCountsAsAbsent() {
        properties.getEnrichment().setLookupTimeout(Duration.ofMillis(100));
        when(lookupService.resolve(any())).thenReturn(Mono.never());

        List<IngredientLookupResult> results = service.enrich(List.of(ingredient("1", 1, "g"))).block();

        assertNotNull(results);
        assertEquals(IngredientLookupResult.Outcome.FAILED, results.get(0).getOutcome());
    }

    @Test
    void testDuplicateKeysShareOneLookup() {
        when(lookupService.resolve(any())).thenAnswer(inv -> Mono.delay(Duration.ofMillis(20))
                .thenReturn(info("7", 50)));

        List<IngredientLookupResult> results = service.enrich(List.of(
                ingredient("7", 100, "g"), ingredient("7", 100.0, "g"))).block();

        assertNotNull(results);
        assertTrue(results.get(0).isPresent());
        assertTrue(results.get(1).isPresent());
        verify(lookupService, times(1)).resolve(any());
    }

    @Test
    void testCachedLookupSkipsRequest() {
        when(lookupService.resolve(any())).thenReturn(Mono.just(info("1", 100)));

        service.enrich(List.of(ingredient("1", 100, "g"))).block();
        List<IngredientLookupResult> second = service.enrich(List.of(ingredient("1", 100, "g"))).block();

        assertNotNull(second);
        assertTrue(second.get(0).isPresent());
        verify(lookupService, times(1)).resolve(any());
    }

    @Test
    void testFailuresCachedWithFailureTtl() {
        CacheStore mockStore = mock(CacheStore.class);
        when(mockStore.get(anyString(), eq(IngredientLookupRecord.class))).thenReturn(Optional.empty());
        when(lookupService.resolve(any())).thenAnswer(inv -> {
            ParsedIngredient p = inv.getArgument(0);
            return "1".equals(p.getId()) ? Mono.just(info("1", 10)) : Mono.error(new IllegalStateException("HTTP 402"));
        });
        NutritionEnrichmentService withMockStore = new NutritionEnrichmentService(lookupService, mockStore, properties);

        withMockStore.enrich(List.of(ingredient("1", 100, "g"), ingredient("2", 1.5, "cup"))).block();

        verify(mockStore).set(eq("inginfo:1:100:g"), any(IngredientLookupRecord.class), eq(Duration.ofHours(24)));
        verify(mockStore).set(eq("inginfo:2:1.5:cup"), any(IngredientLookupRecord.class), eq(Duration.ofSeconds(60)));
    }

    @Test
    void testLookupKeyFallsBackToUnitShortThenDefault() {
        ParsedIngredient shortUnit = ParsedIngredient.builder().id("5").amount(2.0).unitShort("tbsp").build();
        ParsedIngredient noUnit = ParsedIngredient.builder().id("5").amount(2.0).build();

        assertEquals("inginfo:5:2:tbsp", NutritionEnrichmentService.lookupKey(shortUnit));
        assertEquals("inginfo:5:2:unit", NutritionEnrichmentService.lookupKey(noUnit));
    }

    @Test
    void testRecipeParseFailureYieldsNoResults() {
        when(lookupService.parseIngredients(anyList())).thenReturn(Mono.error(new IllegalStateException("quota")));
        CandidateRecipe recipe = CandidateRecipe.builder()
                .title("Pilaf")
                .ingredients(List.of(new RecipeIngredient("rice", "1 cup")))
                .build();

        List<IngredientLookupResult> results = service.enrichRecipe(recipe).block();

        assertNotNull(results);
        assertTrue(results.isEmpty());
    }

    @Test
    void testRecipeLinesSentToParser() {
        when(lookupService.parseIngredients(anyList())).thenReturn(Mono.just(List.of(ingredient("1", 1, "cup"))));
        when(lookupService.resolve(any())).thenReturn(Mono.just(info("1", 200)));
        CandidateRecipe recipe = CandidateRecipe.builder()
                .title("Pilaf")
                .ingredients(List.of(new RecipeIngredient("brown rice", "1 cup"), new RecipeIngredient("salt", null)))
                .build();

        List<IngredientLookupResult> results = service.enrichRecipe(recipe).block();

        verify(lookupService).parseIngredients(List.of("1 cup brown rice", "salt"));
        assertNotNull(results);
        assertEquals(1, results.size());
        assertTrue(results.get(0).isPresent());
    }
}
