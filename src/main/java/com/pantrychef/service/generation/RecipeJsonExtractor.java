package com.pantrychef.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Salvages a JSON object or array from model output.
 *
 * Strategy:
 * 1. Parse the whole (trimmed) text strictly, no trailing tokens allowed
 * 2. Otherwise collect every balanced {...} / [...] span in one string-literal aware pass and
 *    try the largest ones first
 * 3. Otherwise report unparseable
 *
 * Only objects and arrays count as parsed; a bare scalar is unparseable.
 */
@Slf4j
@Component
public class RecipeJsonExtractor {

    /**
     * Spans are tried largest first; each attempt is a full parse, so the number is capped.
     */
    private static final int MAX_CANDIDATES = 32;

    private final ObjectReader strictReader;

    public RecipeJsonExtractor(ObjectMapper objectMapper) {
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ExtractionResult extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.unparseable();
        }

        JsonNode direct = tryParse(text.trim());
        if (direct != null) {
            return ExtractionResult.direct(direct);
        }

        List<Span> spans = balancedSpans(text);
        spans.sort(Comparator.comparingInt(Span::length).reversed());
        int attempts = Math.min(spans.size(), MAX_CANDIDATES);
        for (int i = 0; i < attempts; i++) {
            Span span = spans.get(i);
            JsonNode embedded = tryParse(text.substring(span.getStart(), span.getEnd()));
            if (embedded != null) {
                log.debug("Recovered embedded JSON ({} of {} chars)", span.length(), text.length());
                return ExtractionResult.embedded(embedded);
            }
        }

        if (spans.size() > MAX_CANDIDATES) {
            log.debug("Gave up after {} of {} candidate spans", MAX_CANDIDATES, spans.size());
        }
        return ExtractionResult.unparseable();
    }

    private JsonNode tryParse(String candidate) {
        try {
            JsonNode node = strictReader.readTree(candidate);
            return node != null && node.isContainerNode() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Every opening bracket paired with its matching closer, found in a single pass.
     *
     * Quotes only open a string literal inside a bracket, so apostrophes and quotes in the
     * surrounding prose do not hide the JSON. A mismatched closer abandons all open brackets.
     */
    List<Span> balancedSpans(String text) {
        List<Span> spans = new ArrayList<>();
        Deque<Integer> openers = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }

            switch (c) {
                case '"' -> inString = !openers.isEmpty();
                case '{', '[' -> openers.push(i);
                case '}', ']' -> {
                    if (!openers.isEmpty()) {
                        int start = openers.pop();
                        if (closerFor(text.charAt(start)) == c) {
                            spans.add(new Span(start, i + 1));
                        } else {
                            openers.clear();
                        }
                    }
                }
                default -> {
                    // other characters don't affect nesting
                }
            }
        }
        return spans;
    }

    private static char closerFor(char opener) {
        return opener == '{' ? '}' : ']';
    }

    /**
     * Half-open range [start, end) of a balanced bracket pair.
     */
    @Value
    static class Span {
        int start;
        int end;

        int length() {
            return end - start;
        }
    }
}
