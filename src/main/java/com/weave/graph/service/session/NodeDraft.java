package com.weave.graph.service.session;

import com.weave.graph.service.model.NodeType;
import lombok.Builder;

import java.util.Map;

/**
 * Caller input for inserting or upserting a node.
 *
 * @param id        caller-chosen id, or null to generate one
 * @param frequency initial frequency for a new node; ignored on update
 */
@Builder
public record NodeDraft(
        String id,
        NodeType type,
        String label,
        String description,
        Map<String, Object> metadata,
        Integer frequency
) {
}
