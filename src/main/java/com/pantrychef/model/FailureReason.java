package com.pantrychef.model;

/**
 * Why a pipeline run failed. Surfaced to callers so failure classes stay distinguishable.
 */
public enum FailureReason {

    /**
     * A required downstream credential is missing.
     */
    CONFIGURATION,

    /**
     * Generation output could not be salvaged into recipes.
     */
    GENERATION_FORMAT,

    /**
     * The generation call itself failed (transport, HTTP error, timeout).
     */
    GENERATION_FAILED,

    INTERNAL
}
