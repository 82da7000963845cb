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
 * Immutable graph vertex.
 *
 * Mutations go through the owning GraphStore, which replaces the record with
 * a copy produced by {@link #apply(NodeUpdate, Instant)} or
 * {@link #withIncrementedFrequency(Instant)}.
 */
public record Node(
        String id,
        NodeType type,
        String label,
        String description,
        Map<String, Object> metadata,
        int frequency,
        Instant createdAt,
        Instant updatedAt
) {

    public static final int DEFAULT_FREQUENCY = 1;

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(label, "label");
        if (frequency < 0) {
            throw new IllegalArgumentException("frequency must be non-negative: " + frequency);
        }
        metadata = copyOf(metadata);
        createdAt = createdAt != null ? createdAt : Instant.now();
        updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    @JsonCreator
    static Node fromJson(@JsonProperty("id") String id,
                         @JsonProperty("type") NodeType type,
                         @JsonProperty("label") String label,
                         @JsonProperty("description") String description,
                         @JsonProperty("metadata") Map<String, Object> metadata,
                         @JsonProperty("frequency") Integer frequency,
                         @JsonProperty("createdAt") Instant createdAt,
                         @JsonProperty("updatedAt") Instant updatedAt) {
        return new Node(id, type, label, description, metadata,
                frequency != null ? frequency : DEFAULT_FREQUENCY, createdAt, updatedAt);
    }

    // ==================== Factories ====================

    public static Node create(NodeType type, String label, String description,
                              Map<String, Object> metadata) {
        var now = Instant.now();
        return new Node(UUID.randomUUID().toString(), type, label, description,
                metadata, DEFAULT_FREQUENCY, now, now);
    }

    public static Node concept(String label, String description) {
        return create(NodeType.CONCEPT, label, description, null);
    }

    public static Node decision(String label, String description) {
        return create(NodeType.DECISION, label, description, null);
    }

    public static Node milestone(String label, String description) {
        return create(NodeType.MILESTONE, label, description, null);
    }

    public static Node error(String label, String description) {
        return create(NodeType.ERROR, label, description, null);
    }

    public static Node correction(String label, String description) {
        return create(NodeType.CORRECTION, label, description, null);
    }

    public static Node codeEntity(String label, String description) {
        return create(NodeType.CODE_ENTITY, label, description, null);
    }

    // ==================== Copies ====================

    public Node withId(String newId) {
        return new Node(newId, type, label, description, metadata, frequency, createdAt, updatedAt);
    }

    public Node withFrequency(int newFrequency) {
        return new Node(id, type, label, description, metadata, newFrequency, createdAt, updatedAt);
    }

    public Node withMetadata(Map<String, Object> newMetadata, Instant now) {
        return new Node(id, type, label, description, newMetadata, frequency, createdAt, now);
    }

    public Node withIncrementedFrequency(Instant now) {
        return new Node(id, type, label, description, metadata, frequency + 1, createdAt, now);
    }

    /**
     * Clone-with-overrides: fields left null in the update keep their current value.
     */
    public Node apply(NodeUpdate update, Instant now) {
        return new Node(
                id,
                update.type() != null ? update.type() : type,
                update.label() != null ? update.label() : label,
                update.description() != null ? update.description() : description,
                update.metadata() != null ? update.metadata() : metadata,
                frequency,
                createdAt,
                now
        );
    }

    /**
     * Label followed by description, the text used for similarity scoring.
     */
    public String text() {
        return (label + " " + (description != null ? description : "")).trim();
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
