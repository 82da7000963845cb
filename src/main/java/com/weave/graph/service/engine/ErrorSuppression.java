package com.weave.graph.service.engine;

import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeType;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.model.NodeType;
import com.weave.graph.service.model.NodeUpdate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Error handling policy: ERROR nodes can be marked suppressed and linked to
 * CORRECTION nodes so the same mistake is not surfaced again.
 */
public final class ErrorSuppression {

    public static final String SUPPRESSED = "suppressed";
    public static final String SUPPRESSED_AT = "suppressedAt";

    private ErrorSuppression() {
    }

    /**
     * Copy of {@code node} with {@code suppressed=true} and a suppression timestamp
     * added to its metadata.
     *
     * @throws PolicyViolationException if the node is not an ERROR
     */
    public static Node suppressNode(Node node, Instant now) {
        requireError(node);
        var metadata = new LinkedHashMap<>(node.metadata());
        metadata.put(SUPPRESSED, true);
        metadata.put(SUPPRESSED_AT, now.toString());
        return node.withMetadata(metadata, now);
    }

    public static boolean isSuppressed(Node node) {
        return Boolean.TRUE.equals(node.metadata().get(SUPPRESSED));
    }

    /**
     * A new CORRECTION node and the CORRECTS edge from it to the error.
     */
    public static Correction createCorrection(String errorNodeId, String label, String description) {
        var correction = Node.correction(label, description);
        return new Correction(correction, Edge.corrects(correction.id(), errorNodeId));
    }

    /**
     * Suppresses an ERROR node held by {@code store} and records a correction for it.
     *
     * @throws NodeNotFoundException    if the store has no such node
     * @throws PolicyViolationException if the node is not an ERROR
     */
    public static SuppressionResult suppressError(GraphStore store, String errorNodeId,
                                                  String correctionLabel, String correctionDescription) {
        var error = store.getNode(errorNodeId).orElseThrow(() -> new NodeNotFoundException(errorNodeId));
        var suppressed = suppressNode(error, Instant.now());
        store.updateNode(errorNodeId, NodeUpdate.builder().metadata(suppressed.metadata()).build());

        var correction = createCorrection(errorNodeId, correctionLabel, correctionDescription);
        store.addNode(correction.node());
        store.addEdge(correction.edge());

        return new SuppressionResult(store.getNode(errorNodeId).orElseThrow(), correction.node(), correction.edge());
    }

    /**
     * ERROR nodes with at least one incoming CORRECTS edge, keyed by error id,
     * with the CORRECTION nodes that point at them.
     */
    public static Map<String, CorrectedError> findCorrectedErrors(Map<String, Node> nodes, Collection<Edge> edges) {
        var corrected = new LinkedHashMap<String, CorrectedError>();
        for (Edge edge : edges) {
            if (edge.type() != EdgeType.CORRECTS) {
                continue;
            }
            var error = nodes.get(edge.targetId());
            var correction = nodes.get(edge.sourceId());
            if (error == null || error.type() != NodeType.ERROR || correction == null) {
                continue;
            }
            corrected.computeIfAbsent(error.id(), id -> new CorrectedError(error, new ArrayList<>()))
                    .corrections().add(correction);
        }
        return corrected;
    }

    public static List<Node> findUncorrectedErrors(Map<String, Node> nodes, Collection<Edge> edges) {
        var corrected = findCorrectedErrors(nodes, edges);
        return nodes.values().stream()
                .filter(node -> node.type() == NodeType.ERROR)
                .filter(node -> !corrected.containsKey(node.id()))
                .toList();
    }

    private static void requireError(Node node) {
        if (node.type() != NodeType.ERROR) {
            throw new PolicyViolationException(
                    "Only ERROR nodes can be suppressed, node " + node.id() + " is " + node.type(), node.id());
        }
    }

    // ==================== Results ====================

    public record Correction(Node node, Edge edge) {
    }

    public record CorrectedError(Node error, List<Node> corrections) {
    }

    public record SuppressionResult(Node error, Node correction, Edge correctionEdge) {
    }
}
