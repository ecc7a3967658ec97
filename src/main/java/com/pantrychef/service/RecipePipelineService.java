package com.pantrychef.service;

import com.pantrychef.cache.CacheStore;
import com.pantrychef.config.PantryChefProperties;
import com.pantrychef.exception.GenerationFormatException;
import com.pantrychef.exception.PipelineException;
import com.pantrychef.model.CacheKey;
import com.pantrychef.model.CachedRecipes;
import com.pantrychef.model.CandidateRecipe;
import com.pantrychef.model.EnrichedRecipe;
import com.pantrychef.model.EnrichmentRequest;
import com.pantrychef.model.FailureReason;
import com.pantrychef.model.PipelineResult;
import com.pantrychef.model.PipelineStage;
import com.pantrychef.model.RateLimitDecision;
import com.pantrychef.provider.GenerationService;
import com.pantrychef.service.canonicalization.RequestCanonicalizer;
import com.pantrychef.service.enrichment.NutritionEnrichmentService;
import com.pantrychef.service.generation.GenerationAdapter;
import com.pantrychef.service.nutrition.NutritionAggregator;
import com.pantrychef.service.ratelimit.DailyRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main pipeline that orchestrates rate limiting, recipe cache lookup, generation, enrichment
 * and aggregation.
 *
 * Flow:
 * 1. Count the request against the caller's daily limit
 * 2. Serve the recipe list from cache when the canonical request was seen before
 * 3. Generate candidates (one call, no retries)
 * 4. Enrich each candidate's ingredients, then aggregate nutrition
 * 5. Cache the recipe list
 *
 * Rate limiting and malformed generation output end the run with a distinct status; partial
 * enrichment failures never do.
 */
@Slf4j
@Service
public class RecipePipelineService {

    private final RequestCanonicalizer canonicalizer;
    private final DailyRateLimiter rateLimiter;
    private final CacheStore cacheStore;
    private final GenerationAdapter generationAdapter;
    private final GenerationService generationService;
    private final NutritionEnrichmentService enrichmentService;
    private final NutritionAggregator aggregator;
    private final PantryChefProperties properties;
    private final Clock clock;

    public RecipePipelineService(
            RequestCanonicalizer canonicalizer,
            DailyRateLimiter rateLimiter,
            CacheStore cacheStore,
            GenerationAdapter generationAdapter,
            GenerationService generationService,
            NutritionEnrichmentService enrichmentService,
            NutritionAggregator aggregator,
            PantryChefProperties properties,
            Clock clock) {
        this.canonicalizer = canonicalizer;
        this.rateLimiter = rateLimiter;
        this.cacheStore = cacheStore;
        this.generationAdapter = generationAdapter;
        this.generationService = generationService;
        this.enrichmentService = enrichmentService;
        this.aggregator = aggregator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Run the pipeline for one request.
     *
     * @param request  meal request; must contain at least one ingredient
     * @param identity caller identity used for rate limiting
     * @return DONE, RATE_LIMITED or FAILED result; errors only for invalid input
     */
    public Mono<PipelineResult> runPipeline(EnrichmentRequest request, String identity) {
        if (request == null || request.getIngredients() == null
                || request.getIngredients().stream().noneMatch(i -> i != null && !i.isBlank())) {
            return Mono.error(new IllegalArgumentException("Please provide a non-empty ingredients array"));
        }

        AtomicReference<PipelineStage> stage = new AtomicReference<>(PipelineStage.START);

        return Mono.fromCallable(() -> rateLimiter.checkAndIncrement(identity))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(decision -> afterRateCheck(request, decision, stage))
                .onErrorResume(error -> Mono.just(toFailure(error, stage.get())));
    }

    private Mono<PipelineResult> afterRateCheck(EnrichmentRequest request, RateLimitDecision decision,
                                                AtomicReference<PipelineStage> stage) {
        advance(stage, PipelineStage.RATE_CHECKED);
        if (!decision.isAllowed()) {
            return Mono.just(PipelineResult.rateLimited(decision));
        }

        CacheKey key = canonicalizer.canonicalize(request);

        return Mono.fromCallable(() -> cacheStore.get(key.toRecipeKey(), CachedRecipes.class))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(cached -> {
                    advance(stage, PipelineStage.CACHE_CHECKED);
                    if (cached.isPresent()) {
                        log.info("Recipe cache hit: {}", key.toRecipeKey());
                        advance(stage, PipelineStage.DONE);
                        return Mono.just(PipelineResult.done(cached.get().getRecipes(), true));
                    }
                    log.info("Recipe cache miss: {} - generating", key.toRecipeKey());
                    return generateAndEnrich(request, key, stage);
                });
    }

    private Mono<PipelineResult> generateAndEnrich(EnrichmentRequest request, CacheKey key,
                                                   AtomicReference<PipelineStage> stage) {
        int servings = request.getEffectiveServings();

        return generationAdapter.generate(request)
                .flatMap(candidates -> {
                    advance(stage, PipelineStage.GENERATED);
                    advance(stage, PipelineStage.ENRICHING);
                    return Flux.fromIterable(candidates)
                            .concatMap(recipe -> enrich(recipe, servings))
                            .collectList();
                })
                .flatMap(recipes -> {
                    advance(stage, PipelineStage.AGGREGATED);
                    return storeRecipes(key, recipes);
                })
                .map(recipes -> {
                    advance(stage, PipelineStage.CACHED);
                    advance(stage, PipelineStage.DONE);
                    return PipelineResult.done(recipes, false);
                });
    }

    private Mono<EnrichedRecipe> enrich(CandidateRecipe recipe, int servings) {
        return enrichmentService.enrichRecipe(recipe)
                .map(results -> aggregator.aggregate(recipe, results, servings));
    }

    private Mono<List<EnrichedRecipe>> storeRecipes(CacheKey key, List<EnrichedRecipe> recipes) {
        CachedRecipes payload = CachedRecipes.builder()
                .recipes(recipes)
                .createdAt(clock.instant())
                .build();

        return Mono.fromCallable(() -> {
                    cacheStore.set(key.toRecipeKey(), payload, properties.getCache().getRecipeTtl());
                    return recipes;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private PipelineResult toFailure(Throwable error, PipelineStage stage) {
        if (error instanceof GenerationFormatException) {
            GenerationFormatException formatError = (GenerationFormatException) error;
            log.error("Pipeline failed: {} ({})", formatError.getReason(), formatError.getMessage());
            return PipelineResult.failed(formatError.getReason(), formatError.getMessage(),
                    formatError.getRawText(), PipelineStage.GENERATED);
        }

        if (error instanceof PipelineException) {
            PipelineException pipelineError = (PipelineException) error;
            log.error("Pipeline failed at {}: {} ({})", stage, pipelineError.getReason(), pipelineError.getMessage());
            return PipelineResult.failed(pipelineError.getReason(), pipelineError.getMessage(), null, stage);
        }

        log.error("Pipeline failed at {} with unexpected error", stage, error);
        return PipelineResult.failed(FailureReason.INTERNAL, "Internal error: " + error.getMessage(), null, stage);
    }

    private void advance(AtomicReference<PipelineStage> stage, PipelineStage next) {
        PipelineStage previous = stage.getAndSet(next);
        log.debug("Pipeline stage {} -> {}", previous, next);
    }

    /**
     * Which collaborators are configured. Never includes secrets.
     */
    public Map<String, Object> describeConfiguration() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("generation", generationService.getName());
        status.put("generationConfigured", generationService.isConfigured());
        status.put("mock", properties.getGeneration().isMock());
        status.put("enrichmentEnabled", enrichmentService.isEnabled());
        status.put("enrichmentConcurrency", properties.getEnrichment().getConcurrency());
        status.put("sharedCache", cacheStore.isShared());
        status.put("rateLimitPerDay", properties.getRateLimit().getPerDay());
        status.put("timestamp", Objects.toString(clock.instant()));
        return status;
    }
}
