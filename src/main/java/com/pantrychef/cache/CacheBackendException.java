package com.pantrychef.cache;

/**
 * Failure of the shared cache tier. Always absorbed by {@link TieredCacheStore}.
 */
public class CacheBackendException extends RuntimeException {

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
