package com.weave.graph.service.engine;

import lombok.With;

/**
 * Tuning for {@link SynapticLinker}.
 *
 * @param threshold      minimum similarity score for a candidate to be linked
 * @param maxConnections upper bound on edges created per linking pass
 */
@With
public record LinkerOptions(double threshold, int maxConnections) {

    public static final double DEFAULT_THRESHOLD = 0.72;
    public static final int DEFAULT_MAX_CONNECTIONS = 20;

    public LinkerOptions {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be in [0, 1]: " + threshold);
        }
        if (maxConnections < 0) {
            throw new IllegalArgumentException("maxConnections must be non-negative: " + maxConnections);
        }
    }

    public static LinkerOptions defaults() {
        return new LinkerOptions(DEFAULT_THRESHOLD, DEFAULT_MAX_CONNECTIONS);
    }
}
