package com.weave.graph.service.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time counts for one session graph.
 */
public record GraphStats(
        String chatId,
        int totalNodes,
        int totalEdges,
        Map<NodeType, Integer> nodesByType,
        Map<EdgeType, Integer> edgesByType,
        Instant createdAt,
        Instant updatedAt
) {
}
