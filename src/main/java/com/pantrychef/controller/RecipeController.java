package com.pantrychef.controller;

import com.pantrychef.model.EnrichmentRequest;
import com.pantrychef.model.FailureReason;
import com.pantrychef.model.PipelineResult;
import com.pantrychef.service.IdentityExtractor;
import com.pantrychef.service.RecipePipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Meal generation endpoint.
 */
@Slf4j
@RestController
@RequestMapping("/api/generate-meals")
public class RecipeController {

    private final RecipePipelineService pipelineService;
    private final IdentityExtractor identityExtractor;

    public RecipeController(RecipePipelineService pipelineService, IdentityExtractor identityExtractor) {
        this.pipelineService = pipelineService;
        this.identityExtractor = identityExtractor;
    }

    /**
     * Generate recipes for the posted pantry.
     *
     * 200 DONE, 429 RATE_LIMITED, 502 for generation failures, 500 for configuration and
     * internal failures.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<PipelineResult>> generateMeals(
            @RequestBody EnrichmentRequest request,
            @RequestHeader HttpHeaders headers) {

        String identity = identityExtractor.extract(headers);
        log.info("Received meal request: {} ingredients, diet={}, servings={}",
                request.getIngredients() == null ? 0 : request.getIngredients().size(),
                request.getDiet(), request.getServings());

        return pipelineService.runPipeline(request, identity)
                .map(result -> ResponseEntity.status(statusFor(result)).body(result));
    }

    /**
     * Report which collaborators are configured.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(pipelineService.describeConfiguration());
    }

    static HttpStatus statusFor(PipelineResult result) {
        return switch (result.getStatus()) {
            case DONE -> HttpStatus.OK;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case FAILED -> failureStatus(result.getReason());
        };
    }

    private static HttpStatus failureStatus(FailureReason reason) {
        if (reason == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (reason) {
            case GENERATION_FORMAT, GENERATION_FAILED -> HttpStatus.BAD_GATEWAY;
            case CONFIGURATION, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
