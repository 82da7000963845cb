package com.weave.graph.service.model;

import lombok.Builder;

import java.util.Map;

/**
 * Partial update for a node. Null fields are left untouched.
 *
 * Identity, timestamps and frequency are not updatable here; frequency only
 * grows through {@code GraphStore.incrementFrequency}.
 */
@Builder
public record NodeUpdate(
        NodeType type,
        String label,
        String description,
        Map<String, Object> metadata
) {
}
