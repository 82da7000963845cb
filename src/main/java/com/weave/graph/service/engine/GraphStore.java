package com.weave.graph.service.engine;

import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeType;
import com.weave.graph.service.model.EdgeUpdate;
import com.weave.graph.service.model.GraphSnapshot;
import com.weave.graph.service.model.GraphStats;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.model.NodeType;
import com.weave.graph.service.model.NodeUpdate;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory knowledge graph for one chat session.
 *
 * Owns every node and edge record. The label, type, source and target indices
 * hold ids only and are rebuilt incrementally on each mutating call; they are
 * never consulted as a source of truth for record contents.
 *
 * Not thread-safe: callers sharing an instance must serialize access.
 */
@Slf4j
public class GraphStore implements SynapticGraph, HebbianGraph {

    public static final String VERSION = "0.1.0";
    public static final double DEFAULT_COMPRESSION_THRESHOLD = 0.75;

    private final String chatId;
    private final double compressionThreshold;
    private final Clock clock;

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();

    // Derived indices (ids only)
    private final Map<String, Set<String>> nodesByLabel = new LinkedHashMap<>();
    private final Map<NodeType, Set<String>> nodesByType = new EnumMap<>(NodeType.class);
    private final Map<String, Set<String>> edgesBySource = new HashMap<>();
    private final Map<String, Set<String>> edgesByTarget = new HashMap<>();
    private final Map<EdgeType, Set<String>> edgesByType = new EnumMap<>(EdgeType.class);

    private Instant createdAt;
    private Instant updatedAt;

    private SynapticLinker synapticLinker;
    private HebbianWeightEngine hebbianEngine;

    public GraphStore(String chatId) {
        this(chatId, DEFAULT_COMPRESSION_THRESHOLD, Clock.systemUTC());
    }

    public GraphStore(String chatId, double compressionThreshold) {
        this(chatId, compressionThreshold, Clock.systemUTC());
    }

    public GraphStore(String chatId, double compressionThreshold, Clock clock) {
        this.chatId = Objects.requireNonNull(chatId, "chatId");
        if (!(compressionThreshold > 0 && compressionThreshold <= 1)) {
            throw new IllegalArgumentException(
                    "compressionThreshold must be in (0, 1]: " + compressionThreshold);
        }
        this.compressionThreshold = compressionThreshold;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    // ==================== Collaborators ====================

    /**
     * Attaches a linker so every {@link #addNode(Node)} links the new node
     * retroactively. Pass null to detach.
     */
    public void attachSynapticLinker(SynapticLinker linker) {
        this.synapticLinker = linker;
    }

    /**
     * Attaches a Hebbian engine so label and type queries returning two or
     * more nodes strengthen the edges among them. Pass null to detach.
     */
    public void attachHebbianEngine(HebbianWeightEngine engine) {
        this.hebbianEngine = engine;
    }

    public Optional<SynapticLinker> getSynapticLinker() {
        return Optional.ofNullable(synapticLinker);
    }

    public Optional<HebbianWeightEngine> getHebbianEngine() {
        return Optional.ofNullable(hebbianEngine);
    }

    // ==================== Nodes ====================

    public Node addNode(Node node) {
        reinsertNode(node);
        if (synapticLinker != null) {
            synapticLinker.linkRetroactively(node, this);
        }
        return node;
    }

    /**
     * Stores a node without retroactive linking. Used when the node was
     * already part of this graph, e.g. on snapshot restore or archive restore.
     */
    public Node reinsertNode(Node node) {
        var previous = nodes.put(node.id(), node);
        if (previous != null) {
            unindexNode(previous);
        }
        indexNode(node);
        touch();
        return node;
    }

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Optional<Node> updateNode(String nodeId, NodeUpdate update) {
        var existing = nodes.get(nodeId);
        if (existing == null) {
            return Optional.empty();
        }
        var updated = existing.apply(update, clock.instant());
        replaceNode(existing, updated);
        return Optional.of(updated);
    }

    public Optional<Node> incrementFrequency(String nodeId) {
        var existing = nodes.get(nodeId);
        if (existing == null) {
            return Optional.empty();
        }
        var updated = existing.withIncrementedFrequency(clock.instant());
        replaceNode(existing, updated);
        return Optional.of(updated);
    }

    /**
     * Deletes a node and every edge that has it as source or target.
     *
     * @return false if the id is unknown
     */
    public boolean deleteNode(String nodeId) {
        var node = nodes.remove(nodeId);
        if (node == null) {
            return false;
        }
        unindexNode(node);

        var connected = new LinkedHashSet<String>();
        connected.addAll(edgesBySource.getOrDefault(nodeId, Set.of()));
        connected.addAll(edgesByTarget.getOrDefault(nodeId, Set.of()));
        connected.forEach(this::removeEdgeRecord);

        edgesBySource.remove(nodeId);
        edgesByTarget.remove(nodeId);
        touch();

        log.debug("Deleted node {} with {} connected edges (chat={})", nodeId, connected.size(), chatId);
        return true;
    }

    @Override
    public Collection<Node> getAllNodes() {
        return List.copyOf(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    // ==================== Edges ====================

    @Override
    public Edge addEdge(Edge edge) {
        var previous = edges.put(edge.id(), edge);
        if (previous != null) {
            unindexEdge(previous);
        }
        indexEdge(edge);
        touch();
        return edge;
    }

    @Override
    public Optional<Edge> getEdge(String edgeId) {
        return Optional.ofNullable(edges.get(edgeId));
    }

    @Override
    public Optional<Edge> updateEdge(String edgeId, EdgeUpdate update) {
        var existing = edges.get(edgeId);
        if (existing == null) {
            return Optional.empty();
        }
        var updated = existing.apply(update, clock.instant());
        edges.put(edgeId, updated);
        if (updated.type() != existing.type()) {
            removeFromIndex(edgesByType, existing.type(), edgeId);
            addToIndex(edgesByType, updated.type(), edgeId);
        }
        touch();
        return Optional.of(updated);
    }

    @Override
    public boolean deleteEdge(String edgeId) {
        if (!edges.containsKey(edgeId)) {
            return false;
        }
        removeEdgeRecord(edgeId);
        touch();
        return true;
    }

    @Override
    public List<Edge> getEdgesFrom(String nodeId) {
        return resolveEdges(edgesBySource.get(nodeId));
    }

    public List<Edge> getEdgesTo(String nodeId) {
        return resolveEdges(edgesByTarget.get(nodeId));
    }

    @Override
    public Collection<Edge> getAllEdges() {
        return List.copyOf(edges.values());
    }

    public int edgeCount() {
        return edges.size();
    }

    // ==================== Queries ====================

    /**
     * Case-insensitive substring match over the lowercased label buckets,
     * ordered by descending frequency.
     */
    public List<Node> queryByLabel(String query) {
        var needle = query.toLowerCase(Locale.ROOT);
        var results = new ArrayList<Node>();

        nodesByLabel.forEach((label, ids) -> {
            if (label.contains(needle)) {
                ids.stream().map(nodes::get).filter(Objects::nonNull).forEach(results::add);
            }
        });
        results.sort(Comparator.comparingInt(Node::frequency).reversed());

        coActivate(results);
        return results;
    }

    public List<Node> queryByType(NodeType type) {
        var results = new ArrayList<Node>();
        nodesByType.getOrDefault(type, Set.of()).stream()
                .map(nodes::get)
                .filter(Objects::nonNull)
                .forEach(results::add);

        coActivate(results);
        return results;
    }

    public List<Edge> queryEdgesByType(EdgeType type) {
        return resolveEdges(edgesByType.get(type));
    }

    // ==================== Session State ====================

    public GraphStats getStats() {
        var nodeCounts = new EnumMap<NodeType, Integer>(NodeType.class);
        nodesByType.forEach((type, ids) -> {
            if (!ids.isEmpty()) nodeCounts.put(type, ids.size());
        });
        var edgeCounts = new EnumMap<EdgeType, Integer>(EdgeType.class);
        edgesByType.forEach((type, ids) -> {
            if (!ids.isEmpty()) edgeCounts.put(type, ids.size());
        });
        return new GraphStats(chatId, nodes.size(), edges.size(),
                nodeCounts, edgeCounts, createdAt, updatedAt);
    }

    /**
     * Estimated share of the context budget taken by the active graph, in [0, 1].
     */
    public double getContextWindowUsage() {
        long size = CompressionEngine.calculateContextSize(nodes.values(), edges.values());
        return CompressionEngine.calculateContextUsagePercentage(size);
    }

    public boolean shouldCompress() {
        return getContextWindowUsage() >= compressionThreshold;
    }

    public GraphSnapshot snapshot() {
        return new GraphSnapshot(
                nodes,
                edges,
                new GraphSnapshot.Metadata(chatId, VERSION, createdAt, updatedAt, compressionThreshold)
        );
    }

    /**
     * Rebuilds a store from a snapshot. Collaborators are not carried over;
     * timestamps come from the snapshot metadata.
     */
    public static GraphStore restore(GraphSnapshot snapshot) {
        return restore(snapshot, Clock.systemUTC());
    }

    public static GraphStore restore(GraphSnapshot snapshot, Clock clock) {
        var metadata = snapshot.metadata();
        var store = new GraphStore(metadata.chatId(), metadata.compressionThreshold(), clock);

        snapshot.nodes().values().forEach(store::reinsertNode);
        snapshot.edges().values().forEach(store::addEdge);

        store.createdAt = metadata.createdAt() != null ? metadata.createdAt() : store.createdAt;
        store.updatedAt = metadata.updatedAt() != null ? metadata.updatedAt() : store.updatedAt;
        return store;
    }

    public void clear() {
        nodes.clear();
        edges.clear();
        nodesByLabel.clear();
        nodesByType.clear();
        edgesBySource.clear();
        edgesByTarget.clear();
        edgesByType.clear();
        touch();
    }

    public String getChatId() {
        return chatId;
    }

    public double getCompressionThreshold() {
        return compressionThreshold;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    // ==================== Index Maintenance ====================

    private void replaceNode(Node existing, Node updated) {
        nodes.put(updated.id(), updated);
        if (!labelKey(existing).equals(labelKey(updated)) || existing.type() != updated.type()) {
            unindexNode(existing);
            indexNode(updated);
        }
        touch();
    }

    private void indexNode(Node node) {
        addToIndex(nodesByLabel, labelKey(node), node.id());
        addToIndex(nodesByType, node.type(), node.id());
    }

    private void unindexNode(Node node) {
        removeFromIndex(nodesByLabel, labelKey(node), node.id());
        removeFromIndex(nodesByType, node.type(), node.id());
    }

    private void indexEdge(Edge edge) {
        addToIndex(edgesBySource, edge.sourceId(), edge.id());
        addToIndex(edgesByTarget, edge.targetId(), edge.id());
        addToIndex(edgesByType, edge.type(), edge.id());
    }

    private void unindexEdge(Edge edge) {
        removeFromIndex(edgesBySource, edge.sourceId(), edge.id());
        removeFromIndex(edgesByTarget, edge.targetId(), edge.id());
        removeFromIndex(edgesByType, edge.type(), edge.id());
    }

    private void removeEdgeRecord(String edgeId) {
        var edge = edges.remove(edgeId);
        if (edge != null) {
            unindexEdge(edge);
        }
    }

    private List<Edge> resolveEdges(Set<String> edgeIds) {
        if (edgeIds == null) {
            return List.of();
        }
        return edgeIds.stream()
                .map(edges::get)
                .filter(Objects::nonNull)
                .toList();
    }

    private void coActivate(List<Node> results) {
        if (hebbianEngine != null && results.size() >= 2) {
            hebbianEngine.strengthenCoActivated(results.stream().map(Node::id).toList(), this);
        }
    }

    private void touch() {
        updatedAt = clock.instant();
    }

    private static String labelKey(Node node) {
        return node.label().toLowerCase(Locale.ROOT);
    }

    private static <K> void addToIndex(Map<K, Set<String>> index, K key, String id) {
        index.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(id);
    }

    private static <K> void removeFromIndex(Map<K, Set<String>> index, K key, String id) {
        var ids = index.get(key);
        if (ids != null) {
            ids.remove(id);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }
}
