package com.weave.graph.service.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weave.graph.service.config.EmbeddingConfig;
import com.weave.graph.service.engine.EmbeddingProvider;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Embedding provider backed by an OpenAI-compatible {@code /embeddings} endpoint.
 *
 * Uses the JDK HttpClient asynchronously so a linking pass can issue all of
 * its requests at once. Failures complete the future with an {@link EmbeddingException}.
 */
@Slf4j
public class HttpEmbeddingProvider implements EmbeddingProvider {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final EmbeddingConfig config;

    public HttpEmbeddingProvider(HttpClient httpClient, ObjectMapper objectMapper, EmbeddingConfig config) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public CompletableFuture<double[]> embed(String text) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Cannot embed blank text"));
        }

        String input = text.length() > config.getMaxInputChars()
                ? text.substring(0, config.getMaxInputChars())
                : text;

        HttpRequest request;
        try {
            request = buildRequest(input);
        } catch (EmbeddingException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.debug("Embedding request model={} input-length={}", config.getModel(), input.length());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw new EmbeddingException("Network error calling embedding API", unwrap(error));
                    }
                    return parseResponse(response);
                });
    }

    // ==================== Request / Response ====================

    private HttpRequest buildRequest(String input) {
        var body = serialize(new EmbeddingRequest(input, config.getModel(), config.getDimensions()));
        return HttpRequest.newBuilder()
                .uri(URI.create(config.getBaseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.getApiKey())
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private double[] parseResponse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            throw new EmbeddingException("Embedding API rate-limited");
        }
        if (status < 200 || status >= 300) {
            throw new EmbeddingException("Embedding API returned HTTP %d".formatted(status));
        }

        try {
            var vector = objectMapper.readValue(response.body(), EmbeddingResponse.class).firstEmbedding();
            log.debug("Embedding response dim={}", vector.length);
            return vector;
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse embedding response", e);
        }
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
