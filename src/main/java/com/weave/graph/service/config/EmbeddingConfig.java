package com.weave.graph.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * Only used when weave.features.embedding-linking-enabled is true.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "weave.embedding")
public class EmbeddingConfig {

    /**
     * Base URL; requests go to {@code <baseUrl>/embeddings}.
     */
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey = "";

    private String model = "text-embedding-3-small";

    /**
     * Requested vector size, or null for the model default.
     */
    private Integer dimensions;

    private int timeoutSeconds = 30;

    /**
     * Inputs longer than this are truncated before sending.
     */
    private int maxInputChars = 8000;
}
