package com.reprise.service.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.config.RepriseProperties;
import com.reprise.exception.EmbeddingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Map;

/**
 * Embedding client for OpenAI-compatible {@code /v1/embeddings} endpoints.
 */
@Slf4j
public class OpenAIEmbeddingProvider implements EmbeddingProvider {

    private static final String EMBEDDINGS_PATH = "/v1/embeddings";

    private final WebClient webClient;
    private final RepriseProperties.EmbeddingsConfig config;

    public OpenAIEmbeddingProvider(WebClient webClient, RepriseProperties.EmbeddingsConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isEmpty()) {
            throw new EmbeddingException("Cannot embed empty text");
        }

        long startTime = System.nanoTime();
        JsonNode root;

        try {
            Mono<JsonNode> request = webClient.post()
                    .uri(config.getBaseUrl() + EMBEDDINGS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("model", config.getModel(), "input", text))
                    .retrieve()
                    .bodyToMono(JsonNode.class);

            root = request
                    .retryWhen(Retry.backoff(config.getMaxRetries(), config.getRetryBackoff())
                            .filter(this::isRetryable))
                    .block(config.getTimeout());

        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        }

        float[] embedding = parse(root);

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        log.debug("Generated embedding ({}d) in {}ms", embedding.length, elapsedMs);

        return embedding;
    }

    @Override
    public int dimensions() {
        return config.getDimensions();
    }

    @Override
    public String modelName() {
        return config.getModel();
    }

    private float[] parse(JsonNode root) {
        if (root == null) {
            throw new EmbeddingException("Empty embedding response");
        }

        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new EmbeddingException("Embedding response has no data");
        }

        JsonNode embeddingArray = data.get(0).path("embedding");
        if (!embeddingArray.isArray() || embeddingArray.isEmpty()) {
            throw new EmbeddingException("Embedding response has no vector");
        }

        if (config.getDimensions() > 0 && embeddingArray.size() != config.getDimensions()) {
            throw new EmbeddingException("Expected " + config.getDimensions()
                    + " dimensions, got " + embeddingArray.size());
        }

        float[] embedding = new float[embeddingArray.size()];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = (float) embeddingArray.get(i).asDouble();
        }
        return embedding;
    }

    /**
     * Connection failures and 5xx responses are worth another attempt.
     */
    private boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientRequestException) {
            return true;
        }
        return throwable instanceof WebClientResponseException responseException
                && responseException.getStatusCode().is5xxServerError();
    }
}
