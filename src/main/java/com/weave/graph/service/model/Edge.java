package com.weave.graph.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, typed and weighted relationship between two node ids.
 *
 * Edges reference nodes by id only; the weight is not bounded here.
 */
public record Edge(
        String id,
        String sourceId,
        String targetId,
        EdgeType type,
        double weight,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt
) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public Edge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(type, "type");
        metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        createdAt = createdAt != null ? createdAt : Instant.now();
        updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    @JsonCreator
    static Edge fromJson(@JsonProperty("id") String id,
                         @JsonProperty("sourceId") String sourceId,
                         @JsonProperty("targetId") String targetId,
                         @JsonProperty("type") EdgeType type,
                         @JsonProperty("weight") Double weight,
                         @JsonProperty("metadata") Map<String, Object> metadata,
                         @JsonProperty("createdAt") Instant createdAt,
                         @JsonProperty("updatedAt") Instant updatedAt) {
        return new Edge(id, sourceId, targetId, type,
                weight != null ? weight : DEFAULT_WEIGHT, metadata, createdAt, updatedAt);
    }

    // ==================== Factories ====================

    public static Edge create(String sourceId, String targetId, EdgeType type,
                              Double weight, Map<String, Object> metadata) {
        var now = Instant.now();
        return new Edge(UUID.randomUUID().toString(), sourceId, targetId, type,
                weight != null ? weight : DEFAULT_WEIGHT, metadata, now, now);
    }

    public static Edge relates(String sourceId, String targetId, Double weight) {
        return create(sourceId, targetId, EdgeType.RELATES, weight, null);
    }

    public static Edge causes(String sourceId, String targetId, Double weight) {
        return create(sourceId, targetId, EdgeType.CAUSES, weight, null);
    }

    public static Edge corrects(String correctionId, String errorId) {
        return create(correctionId, errorId, EdgeType.CORRECTS, null, null);
    }

    public static Edge implementsDecision(String codeEntityId, String decisionId) {
        return create(codeEntityId, decisionId, EdgeType.IMPLEMENTS, null, null);
    }

    public static Edge dependsOn(String sourceId, String targetId) {
        return create(sourceId, targetId, EdgeType.DEPENDS_ON, null, null);
    }

    public static Edge blocks(String blockerId, String blockedId) {
        return create(blockerId, blockedId, EdgeType.BLOCKS, null, null);
    }

    // ==================== Copies ====================

    public Edge withWeight(double newWeight, Instant now) {
        return new Edge(id, sourceId, targetId, type, newWeight, metadata, createdAt, now);
    }

    public Edge apply(EdgeUpdate update, Instant now) {
        return new Edge(
                id,
                sourceId,
                targetId,
                update.type() != null ? update.type() : type,
                update.weight() != null ? update.weight() : weight,
                update.metadata() != null ? update.metadata() : metadata,
                createdAt,
                now
        );
    }

    public boolean touches(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }
}
