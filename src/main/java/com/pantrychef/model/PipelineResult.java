package com.pantrychef.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a pipeline run: DONE with recipes, RATE_LIMITED with usage, or FAILED with a reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineResult {

    private PipelineStatus status;

    private List<EnrichedRecipe> recipes;

    private Boolean cached;

    private Long usedToday;

    private Integer limit;

    private FailureReason reason;

    private String message;

    /**
     * Raw generation output, only for GENERATION_FORMAT failures.
     */
    private String raw;

    private PipelineStage failedStage;

    public static PipelineResult done(List<EnrichedRecipe> recipes, boolean cached) {
        return PipelineResult.builder()
                .status(PipelineStatus.DONE)
                .recipes(recipes)
                .cached(cached)
                .build();
    }

    public static PipelineResult rateLimited(RateLimitDecision decision) {
        return PipelineResult.builder()
                .status(PipelineStatus.RATE_LIMITED)
                .usedToday(decision.getCount())
                .limit(decision.getLimit())
                .message("Rate limit exceeded")
                .failedStage(PipelineStage.RATE_CHECKED)
                .build();
    }

    public static PipelineResult failed(FailureReason reason, String message, String raw, PipelineStage stage) {
        return PipelineResult.builder()
                .status(PipelineStatus.FAILED)
                .reason(reason)
                .message(message)
                .raw(raw)
                .failedStage(stage)
                .build();
    }
}
