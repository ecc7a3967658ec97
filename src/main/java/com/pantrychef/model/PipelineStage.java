package com.pantrychef.model;

/**
 * Stages of a single pipeline run, in order. A run either reaches {@link #DONE} or stops at
 * the stage it failed in.
 */
public enum PipelineStage {
    START,
    RATE_CHECKED,
    CACHE_CHECKED,
    GENERATED,
    ENRICHING,
    AGGREGATED,
    CACHED,
    DONE
}
