package com.pantrychef.service.canonicalization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pantrychef.model.CacheKey;
import com.pantrychef.model.EnrichmentRequest;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Canonicalizes meal requests for stable recipe-cache keys.
 *
 * Steps:
 * 1. Ingredients: trim, lower-case, sort (input order is irrelevant)
 * 2. Diet: trim, lower-case
 * 3. Servings: integer, clamped to at least 1
 * 4. Serialize in a fixed field order
 * 5. SHA-256
 *
 * Calorie target and user profile are not part of the key.
 */
@Service
public class RequestCanonicalizer {

    private final ObjectMapper objectMapper;

    public RequestCanonicalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Derive the cache key for a request. Never fails.
     *
     * @param request meal request
     * @return key wrapping a 64 hex char SHA-256 digest
     */
    public CacheKey canonicalize(EnrichmentRequest request) {
        return new CacheKey(DigestUtils.sha256Hex(canonicalForm(request)));
    }

    /**
     * Canonical textual form of a request. Fields are always written in the same order.
     */
    public String canonicalForm(EnrichmentRequest request) {
        List<String> ingredients = new ArrayList<>();
        if (request.getIngredients() != null) {
            request.getIngredients().stream()
                    .filter(Objects::nonNull)
                    .map(this::normalizeString)
                    .forEach(ingredients::add);
        }
        Collections.sort(ingredients);

        ObjectNode node = objectMapper.createObjectNode();
        node.put("diet", request.getDiet() == null ? "" : normalizeString(request.getDiet()));
        ArrayNode ingredientArray = node.putArray("ingredients");
        ingredients.forEach(ingredientArray::add);
        node.put("servings", request.getEffectiveServings());

        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize canonical request", e);
        }
    }

    /**
     * Normalize string (trim, collapse whitespace, lower-case).
     */
    private String normalizeString(String text) {
        return text
                .trim()
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);
    }
}
