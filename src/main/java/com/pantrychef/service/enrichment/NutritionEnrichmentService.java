package com.pantrychef.service.enrichment;

import com.pantrychef.cache.CacheStore;
import com.pantrychef.config.PantryChefProperties;
import com.pantrychef.model.CandidateRecipe;
import com.pantrychef.model.IngredientLookupRecord;
import com.pantrychef.model.IngredientLookupResult;
import com.pantrychef.model.ParsedIngredient;
import com.pantrychef.model.RecipeIngredient;
import com.pantrychef.provider.NutritionLookupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Resolves nutrition for parsed ingredients with bounded concurrency.
 *
 * Scatter/gather: each ingredient becomes one lookup task returning an immutable
 * {@link IngredientLookupResult}; at most {@code concurrency} tasks run at once and results are
 * reassembled in input order. Identical lookup keys within a batch share one request.
 *
 * Every lookup is cached under inginfo:{id}:{amount}:{unit}: successes for the success TTL,
 * failures (errors, timeouts, empty responses) for the much shorter failure TTL. A failed or
 * skipped ingredient becomes an absent result; the batch itself never fails.
 */
@Slf4j
@Service
public class NutritionEnrichmentService {

    static final String KEY_PREFIX = "inginfo:";

    private final NutritionLookupService lookupService;
    private final CacheStore cacheStore;
    private final PantryChefProperties properties;

    public NutritionEnrichmentService(
            NutritionLookupService lookupService,
            CacheStore cacheStore,
            PantryChefProperties properties) {
        this.lookupService = lookupService;
        this.cacheStore = cacheStore;
        this.properties = properties;
    }

    public boolean isEnabled() {
        return lookupService.isEnabled();
    }

    /**
     * Decompose a recipe's ingredient lines and resolve each one.
     * A failed decomposition yields no results, so the recipe falls back to estimates.
     *
     * @param recipe generated recipe
     * @return one result per parsed ingredient, in parse order
     */
    public Mono<List<IngredientLookupResult>> enrichRecipe(CandidateRecipe recipe) {
        List<String> lines = recipe.getIngredients().stream()
                .map(this::ingredientLine)
                .filter(line -> !line.isEmpty())
                .toList();

        if (!lookupService.isEnabled() || lines.isEmpty()) {
            return Mono.just(List.of());
        }

        return lookupService.parseIngredients(lines)
                .defaultIfEmpty(List.of())
                .onErrorResume(error -> {
                    log.warn("Ingredient parsing failed for '{}': {}", recipe.getTitle(), error.getMessage());
                    return Mono.just(List.of());
                })
                .flatMap(this::enrich);
    }

    /**
     * Resolve nutrition for each ingredient.
     *
     * @param ingredients parsed ingredients
     * @return one result per input, same order
     */
    public Mono<List<IngredientLookupResult>> enrich(List<ParsedIngredient> ingredients) {
        if (ingredients.isEmpty()) {
            return Mono.just(List.of());
        }

        int concurrency = Math.max(1, properties.getEnrichment().getConcurrency());

        Map<String, Mono<IngredientLookupRecord>> lookups = new HashMap<>();
        for (ParsedIngredient ingredient : ingredients) {
            if (ingredient.isResolvable()) {
                lookups.computeIfAbsent(lookupKey(ingredient), key -> lookup(key, ingredient).cache());
            }
        }

        return Flux.fromIterable(ingredients)
                .flatMapSequential(ingredient -> resultFor(ingredient, lookups), concurrency)
                .collectList()
                .doOnNext(this::logSummary);
    }

    static String lookupKey(ParsedIngredient ingredient) {
        String amount = BigDecimal.valueOf(ingredient.getAmount()).stripTrailingZeros().toPlainString();
        return KEY_PREFIX + ingredient.getId() + ":" + amount + ":" + ingredient.getEffectiveUnit();
    }

    private Mono<IngredientLookupResult> resultFor(ParsedIngredient ingredient, Map<String, Mono<IngredientLookupRecord>> lookups) {
        if (!ingredient.isResolvable()) {
            log.debug("Skipping ingredient without id/amount: {}", ingredient.getOriginal());
            return Mono.just(IngredientLookupResult.skipped(ingredient));
        }

        return lookups.get(lookupKey(ingredient))
                .map(record -> record.isFailed() || record.getInformation() == null
                        ? IngredientLookupResult.failed(ingredient)
                        : IngredientLookupResult.resolved(ingredient, record.getInformation()))
                .defaultIfEmpty(IngredientLookupResult.failed(ingredient))
                .onErrorResume(error -> {
                    log.warn("Lookup for {} failed unexpectedly: {}", ingredient.getId(), error.getMessage());
                    return Mono.just(IngredientLookupResult.failed(ingredient));
                });
    }

    private Mono<IngredientLookupRecord> lookup(String key, ParsedIngredient ingredient) {
        return Mono.fromCallable(() -> cacheStore.get(key, IngredientLookupRecord.class))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .doOnNext(record -> log.debug("Lookup cache hit: {} (failed={})", key, record.isFailed()))
                .switchIfEmpty(Mono.defer(() -> fetch(key, ingredient)));
    }

    private Mono<IngredientLookupRecord> fetch(String key, ParsedIngredient ingredient) {
        PantryChefProperties.EnrichmentConfig config = properties.getEnrichment();

        return lookupService.resolve(ingredient)
                .timeout(config.getLookupTimeout())
                .map(IngredientLookupRecord::success)
                .switchIfEmpty(Mono.fromSupplier(() -> IngredientLookupRecord.failure("empty response")))
                .onErrorResume(error -> {
                    log.warn("Nutrition lookup failed for {}: {}", key, describe(error));
                    return Mono.just(IngredientLookupRecord.failure(describe(error)));
                })
                .flatMap(record -> store(key, record, record.isFailed() ? config.getFailureTtl() : config.getSuccessTtl()));
    }

    private Mono<IngredientLookupRecord> store(String key, IngredientLookupRecord record, Duration ttl) {
        return Mono.fromCallable(() -> {
                    cacheStore.set(key, record, ttl);
                    return record;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String ingredientLine(RecipeIngredient ingredient) {
        String quantity = ingredient.getQuantity() == null ? "" : ingredient.getQuantity().trim();
        String name = ingredient.getName() == null ? "" : ingredient.getName().trim();
        return (quantity + " " + name).trim();
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "timed out after " + properties.getEnrichment().getLookupTimeout();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private void logSummary(List<IngredientLookupResult> results) {
        long resolved = results.stream().filter(IngredientLookupResult::isPresent).count();
        long skipped = results.stream()
                .filter(result -> result.getOutcome() == IngredientLookupResult.Outcome.SKIPPED)
                .count();
        log.info("Enrichment batch: {} ingredients, {} resolved, {} failed, {} skipped",
                results.size(), resolved, results.size() - resolved - skipped, skipped);
    }
}
