package com.pantrychef.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the rate-limit identity from request headers.
 *
 * First non-blank of: x-proxy-key, x-proxy-token, authorization. Credentials are hashed so the
 * raw value never ends up in cache keys or logs. No credential means "anon".
 */
@Component
public class IdentityExtractor {

    public static final String ANONYMOUS = "anon";

    private static final List<String> IDENTITY_HEADERS = List.of("x-proxy-key", "x-proxy-token", HttpHeaders.AUTHORIZATION);
    private static final int HASH_LENGTH = 16;

    public String extract(HttpHeaders headers) {
        for (String header : IDENTITY_HEADERS) {
            String value = headers.getFirst(header);
            if (value != null && !value.isBlank()) {
                return "key-" + DigestUtils.sha256Hex(value.trim()).substring(0, HASH_LENGTH);
            }
        }
        return ANONYMOUS;
    }
}
