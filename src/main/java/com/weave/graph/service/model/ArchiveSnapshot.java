package com.weave.graph.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable compression archive of one session, stored next to its graph.
 */
public record ArchiveSnapshot(
        String chatId,
        Map<String, Node> nodes,
        Map<String, Edge> edges
) {

    public ArchiveSnapshot {
        Objects.requireNonNull(chatId, "chatId");
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        edges = edges == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(edges));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }
}
