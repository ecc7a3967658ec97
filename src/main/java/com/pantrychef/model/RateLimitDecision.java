package com.pantrychef.model;

import lombok.Value;

@Value
public class RateLimitDecision {

    boolean allowed;

    /**
     * Requests counted today for the identity, including this one.
     */
    long count;

    int limit;
}
