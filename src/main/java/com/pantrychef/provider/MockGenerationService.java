package com.pantrychef.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Returns a canned recipe payload instead of calling a model.
 * Enabled with {@code pantrychef.generation.mock=true}.
 */
@Slf4j
public class MockGenerationService implements GenerationService {

    private final Resource payload;

    public MockGenerationService(Resource payload) {
        this.payload = payload;
    }

    @Override
    public String getName() {
        return "mock";
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public Mono<String> complete(String systemPrompt, String userPrompt) {
        log.info("Mock generation: serving canned recipes from {}", payload.getDescription());
        return Mono.fromCallable(this::readPayload)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String readPayload() {
        try (InputStream in = payload.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read mock recipes", e);
        }
    }
}
