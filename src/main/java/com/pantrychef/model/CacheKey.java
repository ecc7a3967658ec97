package com.pantrychef.model;

import lombok.Value;

/**
 * Fingerprint of a canonicalized request.
 */
@Value
public class CacheKey {

    public static final String RECIPE_NAMESPACE = "recipe:";

    /**
     * SHA-256 of the canonical form (64 hex chars).
     */
    String digest;

    public String toRecipeKey() {
        return RECIPE_NAMESPACE + digest;
    }
}
