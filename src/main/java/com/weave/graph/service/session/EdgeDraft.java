package com.weave.graph.service.session;

import com.weave.graph.service.model.EdgeType;
import lombok.Builder;

import java.util.Map;

/**
 * Caller input for creating an edge between two existing nodes.
 */
@Builder
public record EdgeDraft(
        String sourceId,
        String targetId,
        EdgeType type,
        Double weight,
        Map<String, Object> metadata
) {
}
