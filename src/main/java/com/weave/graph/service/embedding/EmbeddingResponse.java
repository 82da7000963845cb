package com.weave.graph.service.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response from POST /embeddings.
 *
 * <pre>
 * { "object": "list",
 *   "data": [ { "object": "embedding", "index": 0, "embedding": [0.1, -0.2] } ],
 *   "model": "text-embedding-3-small",
 *   "usage": { "prompt_tokens": 8, "total_tokens": 8 } }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingResponse(
        String object,
        List<EmbeddingData> data,
        String model,
        Usage usage
) {

    /**
     * Vector of the first result as a primitive array.
     */
    public double[] firstEmbedding() {
        if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
            throw new EmbeddingException("Embedding response contained no data");
        }
        return data.get(0).embedding().stream()
                .mapToDouble(Double::doubleValue)
                .toArray();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddingData(
            String object,
            int index,
            List<Double> embedding
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(
            @JsonProperty("prompt_tokens") int promptTokens,
            @JsonProperty("total_tokens") int totalTokens
    ) {
    }
}
