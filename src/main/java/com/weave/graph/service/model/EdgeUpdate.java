package com.weave.graph.service.model;

import lombok.Builder;

import java.util.Map;

/**
 * Partial update for an edge. Endpoints are fixed once the edge exists.
 */
@Builder
public record EdgeUpdate(
        EdgeType type,
        Double weight,
        Map<String, Object> metadata
) {

    public static EdgeUpdate weight(double weight) {
        return new EdgeUpdate(null, weight, null);
    }
}
