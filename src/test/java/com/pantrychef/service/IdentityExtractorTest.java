package com.pantrychef.service;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;

class IdentityExtractorTest {

    private final IdentityExtractor extractor = new IdentityExtractor();

    @Test
    void testNoCredentialIsAnonymous() {
        assertEquals("anon", extractor.extract(new HttpHeaders()));
    }

    @Test
    void testCredentialIsHashed() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-proxy-key", "my-secret-key");

        String identity = extractor.extract(headers);

        assertTrue(identity.matches("key-[0-9a-f]{16}"));
        assertFalse(identity.contains("my-secret-key"));
    }

    @Test
    void testHeaderPrecedence() {
        HttpHeaders proxyKey = new HttpHeaders();
        proxyKey.set("x-proxy-key", "a");
        proxyKey.set(HttpHeaders.AUTHORIZATION, "Bearer b");

        HttpHeaders authOnly = new HttpHeaders();
        authOnly.set(HttpHeaders.AUTHORIZATION, "Bearer b");

        HttpHeaders blankProxyKey = new HttpHeaders();
        blankProxyKey.set("x-proxy-key", "  ");
        blankProxyKey.set("x-proxy-token", "a");

        assertNotEquals(extractor.extract(proxyKey), extractor.extract(authOnly));
        assertEquals(extractor.extract(proxyKey), extractor.extract(blankProxyKey));
    }
}
