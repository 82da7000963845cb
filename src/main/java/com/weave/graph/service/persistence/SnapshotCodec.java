package com.weave.graph.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.weave.graph.service.model.ArchiveSnapshot;
import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.GraphSnapshot;
import com.weave.graph.service.model.Node;

import java.util.Map;

/**
 * Converts snapshots to and from their JSON wire form.
 *
 * Nodes and edges are id-keyed objects, timestamps are ISO-8601 strings.
 * Decoding is all-or-nothing: any structural problem raises
 * {@link MalformedSnapshotException}.
 */
public class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public SnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public JsonNode encode(GraphSnapshot snapshot) {
        return objectMapper.valueToTree(snapshot);
    }

    public GraphSnapshot decode(String key, JsonNode json) {
        requireObject(key, json, "snapshot");
        requireObject(key, json.get("nodes"), "nodes");
        requireObject(key, json.get("edges"), "edges");
        requireObject(key, json.get("metadata"), "metadata");

        GraphSnapshot snapshot;
        try {
            snapshot = objectMapper.treeToValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException(key, e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException(key, e.getMessage(), e);
        }

        verifyIds(key, snapshot.nodes(), snapshot.edges());
        return snapshot;
    }

    public JsonNode encodeArchive(ArchiveSnapshot archive) {
        return objectMapper.valueToTree(archive);
    }

    public ArchiveSnapshot decodeArchive(String key, JsonNode json) {
        requireObject(key, json, "archive");
        requireObject(key, json.get("nodes"), "nodes");
        requireObject(key, json.get("edges"), "edges");

        ArchiveSnapshot archive;
        try {
            archive = objectMapper.treeToValue(json, ArchiveSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException(key, e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException(key, e.getMessage(), e);
        }

        verifyIds(key, archive.nodes(), archive.edges());
        return archive;
    }

    public String toJson(GraphSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Snapshot is not serializable", e);
        }
    }

    private void verifyIds(String key, Map<String, Node> nodes, Map<String, Edge> edges) {
        for (Map.Entry<String, Node> entry : nodes.entrySet()) {
            if (entry.getValue() == null || !entry.getKey().equals(entry.getValue().id())) {
                throw new MalformedSnapshotException(key, "node entry '" + entry.getKey() + "' does not match its id");
            }
        }
        for (Map.Entry<String, Edge> entry : edges.entrySet()) {
            if (entry.getValue() == null || !entry.getKey().equals(entry.getValue().id())) {
                throw new MalformedSnapshotException(key, "edge entry '" + entry.getKey() + "' does not match its id");
            }
        }
    }

    private static void requireObject(String key, JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            throw new MalformedSnapshotException(key, "'" + field + "' must be a JSON object");
        }
    }
}
