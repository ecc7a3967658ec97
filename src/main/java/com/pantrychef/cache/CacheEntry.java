package com.pantrychef.cache;

import lombok.Value;

import java.time.Instant;

/**
 * Local-tier entry with an absolute expiry.
 */
@Value
public class CacheEntry {

    Object value;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
