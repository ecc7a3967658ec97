package com.pantrychef.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pantrychef.config.PantryChefProperties;
import com.pantrychef.exception.ConfigurationException;
import com.pantrychef.exception.GenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * OpenAI chat completion endpoint.
 *
 * Called once per pipeline run with no retries: a failed call fails the run.
 */
@Slf4j
public class OpenAIGenerationService implements GenerationService {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final PantryChefProperties.GenerationConfig config;

    public OpenAIGenerationService(
            WebClient webClient,
            ObjectMapper objectMapper,
            PantryChefProperties.GenerationConfig config) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(config.getApiKey());
    }

    @Override
    public Mono<String> complete(String systemPrompt, String userPrompt) {
        if (!isConfigured()) {
            return Mono.error(new ConfigurationException("OpenAI API key is not configured"));
        }

        log.info("Requesting recipes from OpenAI: model={}", config.getModel());

        String endpoint = config.getBaseUrl() + "/chat/completions";

        return webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildRequest(systemPrompt, userPrompt).toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(this::extractContent)
                .onErrorMap(error -> !(error instanceof GenerationException),
                        error -> new GenerationException("OpenAI request failed: " + error.getMessage(), error))
                .doOnError(error -> log.error("OpenAI request failed: {}", error.getMessage()));
    }

    private JsonNode buildRequest(String systemPrompt, String userPrompt) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", config.getModel());

        ArrayNode messages = request.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);

        request.put("temperature", config.getTemperature());
        request.put("max_tokens", config.getMaxTokens());
        return request;
    }

    /**
     * Read choices[0].message.content, falling back to the legacy choices[0].text.
     */
    private String extractContent(JsonNode response) {
        JsonNode choice = response.path("choices").path(0);
        JsonNode content = choice.path("message").path("content");
        if (content.isTextual()) {
            return content.asText();
        }
        JsonNode text = choice.path("text");
        if (text.isTextual()) {
            return text.asText();
        }
        throw new GenerationException("OpenAI response has no message content", null);
    }
}
