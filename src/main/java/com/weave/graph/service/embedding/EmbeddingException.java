package com.weave.graph.service.embedding;

/**
 * Transport or protocol failure talking to the embedding service.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
