package com.weave.graph.service.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.weave.graph.service.model.ArchiveSnapshot;
import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.model.NodeType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores node importance under context-size pressure and relocates the least
 * important nodes, with their edges, into a reversible archive.
 *
 * One instance holds the archive of one session.
 */
@Slf4j
public class CompressionEngine {

    public static final int MAX_CONTEXT_BYTES = 100_000;
    public static final double DEFAULT_TARGET_REDUCTION = 0.3;

    private static final int NODE_OVERHEAD_BYTES = 50;
    private static final int EDGE_OVERHEAD_BYTES = 100;
    private static final int BYTES_PER_CHAR = 2;

    private static final double CONNECTION_WEIGHT = 2.0;
    private static final double ERROR_PENALTY = 5.0;
    private static final double MIN_ERROR_SCORE = 0.1;
    private static final Duration STALE_AGE = Duration.ofHours(24);
    private static final int STALE_FREQUENCY = 3;
    private static final double STALE_FACTOR = 0.5;

    private static final ObjectMapper METADATA_MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private final Map<String, Node> archivedNodes = new LinkedHashMap<>();
    private final Map<String, Edge> archivedEdges = new LinkedHashMap<>();
    private final Clock clock;

    public CompressionEngine() {
        this(Clock.systemUTC());
    }

    public CompressionEngine(Clock clock) {
        this.clock = clock;
    }

    // ==================== Size Estimation ====================

    public static long estimateNodeSize(Node node) {
        int description = node.description() != null ? node.description().length() : 0;
        return NODE_OVERHEAD_BYTES
                + (long) node.label().length() * BYTES_PER_CHAR
                + (long) description * BYTES_PER_CHAR
                + metadataLength(node.metadata());
    }

    public static long estimateEdgeSize(Edge edge) {
        return EDGE_OVERHEAD_BYTES + metadataLength(edge.metadata());
    }

    public static long calculateContextSize(Collection<Node> nodes, Collection<Edge> edges) {
        long size = 0;
        for (Node node : nodes) {
            size += estimateNodeSize(node);
        }
        for (Edge edge : edges) {
            size += estimateEdgeSize(edge);
        }
        return size;
    }

    public static double calculateContextUsagePercentage(long sizeBytes) {
        return Math.min((double) sizeBytes / MAX_CONTEXT_BYTES, 1.0);
    }

    private static int metadataLength(Map<String, Object> metadata) {
        try {
            return METADATA_MAPPER.writeValueAsString(metadata).length();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not JSON-serializable", e);
        }
    }

    // ==================== Importance ====================

    /**
     * Ids of the least important nodes, worst first. The result size is
     * {@code ceil(nodes.size() * targetReductionPercentage)}.
     */
    public List<String> identifyArchiveCandidates(Collection<Node> nodes, Collection<Edge> edges,
                                                  double targetReductionPercentage) {
        if (targetReductionPercentage < 0 || targetReductionPercentage > 1) {
            throw new IllegalArgumentException(
                    "targetReductionPercentage must be in [0, 1]: " + targetReductionPercentage);
        }

        var connections = new HashMap<String, Integer>();
        for (Edge edge : edges) {
            connections.merge(edge.sourceId(), 1, Integer::sum);
            connections.merge(edge.targetId(), 1, Integer::sum);
        }

        var now = clock.instant();
        var scored = new ArrayList<Map.Entry<String, Double>>(nodes.size());
        for (Node node : nodes) {
            double score = node.frequency() + CONNECTION_WEIGHT * connections.getOrDefault(node.id(), 0);
            if (node.type() == NodeType.ERROR) {
                score = Math.max(MIN_ERROR_SCORE, score - ERROR_PENALTY);
            }
            boolean stale = Duration.between(node.updatedAt(), now).compareTo(STALE_AGE) > 0;
            if (stale && node.frequency() < STALE_FREQUENCY) {
                score *= STALE_FACTOR;
            }
            scored.add(Map.entry(node.id(), score));
        }
        scored.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));

        int target = (int) Math.min(nodes.size(), Math.ceil(nodes.size() * targetReductionPercentage));
        return scored.stream()
                .limit(target)
                .map(Map.Entry::getKey)
                .toList();
    }

    // ==================== Archive ====================

    /**
     * Copies the named nodes and every edge touching them into the archive.
     * The caller removes them from the active graph.
     */
    public Archived archiveNodes(Collection<String> nodeIds, Map<String, Node> nodes, Map<String, Edge> edges) {
        var ids = new LinkedHashSet<>(nodeIds);
        var movedNodes = new ArrayList<Node>();
        var movedEdges = new ArrayList<Edge>();

        for (String id : ids) {
            var node = nodes.get(id);
            if (node != null) {
                archivedNodes.put(id, node);
                movedNodes.add(node);
            }
        }
        for (Edge edge : edges.values()) {
            if (ids.contains(edge.sourceId()) || ids.contains(edge.targetId())) {
                archivedEdges.put(edge.id(), edge);
                movedEdges.add(edge);
            }
        }
        return new Archived(movedNodes, movedEdges);
    }

    /**
     * Takes the named nodes out of the archive, together with the archived
     * edges whose endpoints are no longer archived.
     */
    public Archived restoreNodes(Collection<String> nodeIds) {
        var restoredNodes = new ArrayList<Node>();
        for (String id : new LinkedHashSet<>(nodeIds)) {
            var node = archivedNodes.remove(id);
            if (node != null) {
                restoredNodes.add(node);
            }
        }

        var restoredEdges = new ArrayList<Edge>();
        var iterator = archivedEdges.values().iterator();
        while (iterator.hasNext()) {
            var edge = iterator.next();
            if (!archivedNodes.containsKey(edge.sourceId()) && !archivedNodes.containsKey(edge.targetId())) {
                restoredEdges.add(edge);
                iterator.remove();
            }
        }
        return new Archived(restoredNodes, restoredEdges);
    }

    public ArchiveStats getArchiveStats() {
        return new ArchiveStats(archivedNodes.size(), archivedEdges.size());
    }

    public Set<String> getArchivedNodeIds() {
        return Set.copyOf(archivedNodes.keySet());
    }

    public void clearArchives() {
        archivedNodes.clear();
        archivedEdges.clear();
    }

    public ArchiveSnapshot snapshotArchive(String chatId) {
        return new ArchiveSnapshot(chatId, archivedNodes, archivedEdges);
    }

    /**
     * Replaces the archive with the content of a persisted one.
     */
    public void loadArchive(ArchiveSnapshot archive) {
        clearArchives();
        archivedNodes.putAll(archive.nodes());
        archivedEdges.putAll(archive.edges());
        log.debug("Loaded archive for chat {}: {} nodes, {} edges",
                archive.chatId(), archivedNodes.size(), archivedEdges.size());
    }

    // ==================== Store Integration ====================

    /**
     * Archives the least important share of {@code store} and removes it
     * from the active graph.
     */
    public CompressionResult compress(GraphStore store, double targetReductionPercentage) {
        var snapshot = store.snapshot();
        int originalNodes = snapshot.nodes().size();
        int originalEdges = snapshot.edges().size();

        var candidates = identifyArchiveCandidates(
                snapshot.nodes().values(), snapshot.edges().values(), targetReductionPercentage);
        var archived = archiveNodes(candidates, snapshot.nodes(), snapshot.edges());
        candidates.forEach(store::deleteNode);

        long contextSize = calculateContextSize(store.getAllNodes(), store.getAllEdges());
        log.info("Compressed chat {}: archived {} nodes and {} edges ({} -> {} nodes)",
                store.getChatId(), archived.nodes().size(), archived.edges().size(),
                originalNodes, store.nodeCount());

        return new CompressionResult(
                originalNodes,
                originalEdges,
                store.nodeCount(),
                store.edgeCount(),
                archived.nodes().size(),
                originalNodes == 0 ? 1.0 : (double) store.nodeCount() / originalNodes,
                contextSize
        );
    }

    /**
     * Moves archived nodes back into {@code store} without relinking them.
     */
    public Archived restore(GraphStore store, Collection<String> nodeIds) {
        var restored = restoreNodes(nodeIds);
        restored.nodes().forEach(store::reinsertNode);
        restored.edges().forEach(store::addEdge);
        log.info("Restored {} nodes and {} edges into chat {}",
                restored.nodes().size(), restored.edges().size(), store.getChatId());
        return restored;
    }

    // ==================== Results ====================

    public record Archived(List<Node> nodes, List<Edge> edges) {
    }

    public record ArchiveStats(int archivedNodes, int archivedEdges) {
    }

    public record CompressionResult(
            int originalNodeCount,
            int originalEdgeCount,
            int compressedNodeCount,
            int compressedEdgeCount,
            int archivedNodeCount,
            double compressionRatio,
            long estimatedContextSize
    ) {
    }
}
