package com.pantrychef.provider;

import reactor.core.publisher.Mono;

/**
 * Text generation endpoint used to draft recipes.
 * Output is free text that may or may not contain valid JSON.
 */
public interface GenerationService {

    /**
     * Get service name (e.g., "openai", "mock").
     *
     * @return service name
     */
    String getName();

    /**
     * Run one completion.
     *
     * @param systemPrompt instructions
     * @param userPrompt   request-specific content
     * @return the generated text
     */
    Mono<String> complete(String systemPrompt, String userPrompt);

    /**
     * Check if the service has the credentials it needs.
     *
     * @return true if ready to use
     */
    boolean isConfigured();
}
