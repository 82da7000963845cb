package com.weave.graph.service.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Request body for POST /embeddings (OpenAI-compatible).
 *
 * <pre>
 * { "input": "text to embed", "model": "text-embedding-3-small", "dimensions": 1536 }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        String input,
        String model,
        Integer dimensions
) {
}
