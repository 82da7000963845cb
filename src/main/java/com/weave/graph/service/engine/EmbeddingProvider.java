package com.weave.graph.service.engine;

import java.util.concurrent.CompletableFuture;

/**
 * External text embedding capability used by embedding-mode linking.
 *
 * Implementations must not block the calling thread; a failed request
 * completes the future exceptionally.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    CompletableFuture<double[]> embed(String text);
}
