package com.pantrychef.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of salvaging JSON from free text: either a parsed object/array or unparseable.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExtractionResult {

    public enum Kind {
        /**
         * The whole text was valid JSON.
         */
        DIRECT,

        /**
         * JSON was found embedded in surrounding text.
         */
        EMBEDDED,

        UNPARSEABLE
    }

    private final Kind kind;
    private final JsonNode node;

    public static ExtractionResult direct(JsonNode node) {
        return new ExtractionResult(Kind.DIRECT, node);
    }

    public static ExtractionResult embedded(JsonNode node) {
        return new ExtractionResult(Kind.EMBEDDED, node);
    }

    public static ExtractionResult unparseable() {
        return new ExtractionResult(Kind.UNPARSEABLE, null);
    }

    public boolean isParsed() {
        return kind != Kind.UNPARSEABLE;
    }
}
