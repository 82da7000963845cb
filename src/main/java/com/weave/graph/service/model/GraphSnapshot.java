package com.weave.graph.service.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Complete serializable state of one session's graph.
 *
 * Nodes and edges are id-keyed maps, in insertion order.
 */
public record GraphSnapshot(
        Map<String, Node> nodes,
        Map<String, Edge> edges,
        Metadata metadata
) {

    public GraphSnapshot {
        Objects.requireNonNull(metadata, "metadata");
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        edges = edges == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(edges));
    }

    public String chatId() {
        return metadata.chatId();
    }

    /**
     * Session-level metadata stored alongside the graph.
     */
    public record Metadata(
            String chatId,
            String version,
            Instant createdAt,
            Instant updatedAt,
            double compressionThreshold
    ) {

        public Metadata {
            Objects.requireNonNull(chatId, "chatId");
            if (!(compressionThreshold > 0 && compressionThreshold <= 1)) {
                throw new IllegalArgumentException(
                        "compressionThreshold must be in (0, 1]: " + compressionThreshold);
            }
        }
    }
}
