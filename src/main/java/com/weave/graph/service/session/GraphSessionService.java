package com.weave.graph.service.session;

import com.weave.graph.service.config.CompressionConfig;
import com.weave.graph.service.config.MetricsConfig;
import com.weave.graph.service.config.RetentionConfig;
import com.weave.graph.service.config.WeaveConfig;
import com.weave.graph.service.engine.CompressionEngine;
import com.weave.graph.service.engine.ErrorSuppression;
import com.weave.graph.service.engine.GraphStore;
import com.weave.graph.service.engine.HebbianWeightEngine;
import com.weave.graph.service.engine.NodeNotFoundException;
import com.weave.graph.service.engine.PolicyViolationException;
import com.weave.graph.service.engine.SynapticLinker;
import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeType;
import com.weave.graph.service.model.EdgeUpdate;
import com.weave.graph.service.model.GraphSnapshot;
import com.weave.graph.service.model.GraphStats;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.model.NodeType;
import com.weave.graph.service.model.NodeUpdate;
import com.weave.graph.service.persistence.GraphPersistenceManager;
import com.weave.graph.service.persistence.GraphPersistenceManager.SessionSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Session-level operations over per-chat graphs.
 *
 * Every call runs under the session lock, so one chat's graph is only ever
 * touched by one thread at a time. Sessions are loaded on first use and
 * saved after each mutation when auto-save is on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphSessionService {

    public static final String CORRECTION_LABEL_PREFIX = "Correction: ";
    public static final String MILESTONE_STATUS = "status";
    public static final String MILESTONE_ACTUAL_HOURS = "actual_hours";
    public static final String STATUS_DONE = "DONE";

    private static final int CONTEXT_TOP_NODES = 20;

    private final SessionRegistry sessionRegistry;
    private final GraphPersistenceManager persistenceManager;
    private final SynapticLinker synapticLinker;
    private final HebbianWeightEngine hebbianEngine;
    private final WeaveConfig weaveConfig;
    private final CompressionConfig compressionConfig;
    private final RetentionConfig retentionConfig;
    private final MetricsConfig metricsConfig;

    // ==================== Nodes ====================

    /**
     * Inserts a node, or updates it in place when the draft names an existing id.
     * New nodes are linked retroactively; updates never create synapses.
     */
    public NodeResult saveNode(String chatId, NodeDraft draft) {
        requireText(draft.label(), "label");
        if (draft.type() == null) {
            throw new IllegalArgumentException("type is required");
        }

        return write(chatId, session -> {
            var store = session.getStore();
            if (draft.id() != null && store.getNode(draft.id()).isPresent()) {
                var update = NodeUpdate.builder()
                        .type(draft.type())
                        .label(draft.label())
                        .description(draft.description())
                        .metadata(draft.metadata())
                        .build();
                var updated = store.updateNode(draft.id(), update).orElseThrow();
                log.debug("Updated node {} in chat {}", updated.id(), chatId);
                return new NodeResult(updated, List.of(), false);
            }

            var node = store.addNode(newNode(draft));
            count(metricsConfig.getNodesAdded(), 1);
            var synapses = link(store, node);
            compressIfNeeded(session);
            return new NodeResult(node, synapses, true);
        });
    }

    public Optional<Node> getNode(String chatId, String nodeId) {
        return read(chatId, session -> session.getStore().getNode(nodeId));
    }

    public Optional<Node> updateNode(String chatId, String nodeId, NodeUpdate update) {
        return write(chatId, session -> session.getStore().updateNode(nodeId, update));
    }

    public Optional<Node> incrementFrequency(String chatId, String nodeId) {
        return write(chatId, session -> session.getStore().incrementFrequency(nodeId));
    }

    public boolean deleteNode(String chatId, String nodeId) {
        return write(chatId, session -> session.getStore().deleteNode(nodeId));
    }

    // ==================== Edges ====================

    /**
     * Creates an edge between two nodes the session holds.
     *
     * @throws NodeNotFoundException if either endpoint is unknown
     */
    public Edge addEdge(String chatId, EdgeDraft draft) {
        if (draft.type() == null) {
            throw new IllegalArgumentException("type is required");
        }
        return write(chatId, session -> {
            var store = session.getStore();
            requireNode(store, draft.sourceId());
            requireNode(store, draft.targetId());
            var edge = Edge.create(draft.sourceId(), draft.targetId(), draft.type(),
                    draft.weight(), draft.metadata());
            return store.addEdge(edge);
        });
    }

    public Optional<Edge> getEdge(String chatId, String edgeId) {
        return read(chatId, session -> session.getStore().getEdge(edgeId));
    }

    public Optional<Edge> updateEdge(String chatId, String edgeId, EdgeUpdate update) {
        return write(chatId, session -> session.getStore().updateEdge(edgeId, update));
    }

    public boolean deleteEdge(String chatId, String edgeId) {
        return write(chatId, session -> session.getStore().deleteEdge(edgeId));
    }

    public List<Edge> getEdgesFrom(String chatId, String nodeId) {
        return read(chatId, session -> session.getStore().getEdgesFrom(nodeId));
    }

    public List<Edge> getEdgesTo(String chatId, String nodeId) {
        return read(chatId, session -> session.getStore().getEdgesTo(nodeId));
    }

    // ==================== Queries ====================

    /**
     * Label query, most frequent first. The whole result set counts as
     * co-activated for Hebbian strengthening, not just the returned page.
     */
    public List<Node> queryGraph(String chatId, String query, int limit) {
        requireText(query, "query");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return write(chatId, session -> {
            var results = session.getStore().queryByLabel(query);
            coActivate(session.getStore(), results);
            return results.stream().limit(limit).toList();
        });
    }

    public List<Node> queryByType(String chatId, NodeType type) {
        return write(chatId, session -> {
            var results = session.getStore().queryByType(type);
            coActivate(session.getStore(), results);
            return results;
        });
    }

    public List<Edge> queryEdgesByType(String chatId, EdgeType type) {
        return read(chatId, session -> session.getStore().queryEdgesByType(type));
    }

    /**
     * Nodes with no incoming or outgoing edge.
     */
    public List<Node> listOrphans(String chatId) {
        return read(chatId, session -> {
            var store = session.getStore();
            return store.getAllNodes().stream()
                    .filter(node -> store.getEdgesFrom(node.id()).isEmpty())
                    .filter(node -> store.getEdgesTo(node.id()).isEmpty())
                    .toList();
        });
    }

    // ==================== Errors ====================

    /**
     * Suppresses an error and records its correction. A missing error node is
     * created first from {@code label} and {@code description}; an existing
     * node of another type is rejected.
     */
    public ErrorSuppression.SuppressionResult suppressError(String chatId, String nodeId,
                                                            String label, String description) {
        requireText(nodeId, "nodeId");
        requireText(label, "label");

        return write(chatId, session -> {
            var store = session.getStore();
            if (store.getNode(nodeId).isEmpty()) {
                var error = store.addNode(Node.create(NodeType.ERROR, label, description, null).withId(nodeId));
                count(metricsConfig.getNodesAdded(), 1);
                link(store, error);
                log.info("Created ERROR node {} for suppression in chat {}", nodeId, chatId);
            }

            var result = ErrorSuppression.suppressError(store, nodeId, CORRECTION_LABEL_PREFIX + label, description);
            count(metricsConfig.getErrorsSuppressed(), 1);
            log.info("Suppressed error {} in chat {} with correction {}", nodeId, chatId, result.correction().id());
            return result;
        });
    }

    public List<Node> findUncorrectedErrors(String chatId) {
        return read(chatId, session -> {
            var snapshot = session.getStore().snapshot();
            return ErrorSuppression.findUncorrectedErrors(snapshot.nodes(), snapshot.edges().values());
        });
    }

    public Map<String, ErrorSuppression.CorrectedError> findCorrectedErrors(String chatId) {
        return read(chatId, session -> {
            var snapshot = session.getStore().snapshot();
            return ErrorSuppression.findCorrectedErrors(snapshot.nodes(), snapshot.edges().values());
        });
    }

    // ==================== Milestones ====================

    /**
     * Records progress on a MILESTONE node in its metadata.
     *
     * @throws NodeNotFoundException    if the node is unknown
     * @throws PolicyViolationException if the node is not a MILESTONE
     */
    public Node updateMilestone(String chatId, String milestoneId, String status, Double actualHours) {
        requireText(status, "status");
        return write(chatId, session -> {
            var store = session.getStore();
            var node = requireNode(store, milestoneId);
            if (node.type() != NodeType.MILESTONE) {
                throw new PolicyViolationException(
                        "Node " + milestoneId + " is " + node.type() + ", not a MILESTONE", milestoneId);
            }

            var metadata = new LinkedHashMap<>(node.metadata());
            metadata.put(MILESTONE_STATUS, status);
            metadata.put(MILESTONE_ACTUAL_HOURS, actualHours != null ? actualHours : 0.0);
            return store.updateNode(milestoneId, NodeUpdate.builder().metadata(metadata).build()).orElseThrow();
        });
    }

    /**
     * First MILESTONE, in insertion order, whose status is not DONE.
     */
    public Optional<Node> getNextAction(String chatId) {
        return read(chatId, session -> session.getStore().getAllNodes().stream()
                .filter(node -> node.type() == NodeType.MILESTONE)
                .filter(node -> !STATUS_DONE.equals(node.metadata().get(MILESTONE_STATUS)))
                .findFirst());
    }

    // ==================== Session State ====================

    /**
     * @throws SessionNotFoundException if the chat is neither open nor persisted
     */
    public GraphStats getStats(String chatId) {
        return readExisting(chatId, session -> session.getStore().getStats());
    }

    public SessionContext getSessionContext(String chatId) {
        return readExisting(chatId, session -> {
            var store = session.getStore();
            var nodes = store.getAllNodes();
            var edges = store.getAllEdges();
            long contextSize = CompressionEngine.calculateContextSize(nodes, edges);

            var topNodes = nodes.stream()
                    .sorted(Comparator.comparingInt(Node::frequency).reversed())
                    .limit(CONTEXT_TOP_NODES)
                    .toList();
            var snapshot = store.snapshot();
            int uncorrected = ErrorSuppression.findUncorrectedErrors(snapshot.nodes(), edges).size();

            return new SessionContext(
                    chatId,
                    store.getStats(),
                    contextSize,
                    CompressionEngine.calculateContextUsagePercentage(contextSize),
                    store.shouldCompress(),
                    topNodes,
                    uncorrected,
                    session.getCompressionEngine().getArchiveStats()
            );
        });
    }

    public GraphSnapshot exportSnapshot(String chatId) {
        return readExisting(chatId, session -> session.getStore().snapshot());
    }

    /**
     * True if the session is open or persisted.
     */
    public boolean sessionExists(String chatId) {
        return sessionRegistry.exists(chatId) || persistenceManager.graphExists(chatId);
    }

    /**
     * Persisted sessions merged with open ones; open sessions report live counts.
     */
    public List<SessionSummary> listSessions() {
        var summaries = new TreeMap<String, SessionSummary>();
        persistenceManager.listSessions().forEach(summary -> summaries.put(summary.chatId(), summary));
        for (GraphSession session : sessionRegistry.findAll()) {
            executeIfOpen(session, false, open -> {
                var stats = open.getStore().getStats();
                summaries.put(stats.chatId(), new SessionSummary(stats.chatId(), stats.createdAt(),
                        stats.updatedAt(), stats.totalNodes(), stats.totalEdges()));
                return stats;
            });
        }
        return List.copyOf(summaries.values());
    }

    /**
     * Closes the session and deletes its persisted graph.
     *
     * @return false if the session was neither open nor persisted
     */
    public boolean deleteSession(String chatId) {
        boolean open = sessionRegistry.findById(chatId)
                .map(session -> executeIfOpen(session, false,
                        s -> sessionRegistry.remove(chatId)).orElse(false))
                .orElse(false);
        boolean persisted = persistenceManager.deleteGraph(chatId);
        if (open || persisted) {
            log.info("Session deleted: {}", chatId);
        }
        return open || persisted;
    }

    /**
     * Persists an open session now, regardless of auto-save.
     *
     * @return false if the session is not open
     */
    public boolean saveSession(String chatId) {
        return sessionRegistry.findById(chatId)
                .flatMap(session -> executeIfOpen(session, false, open -> {
                    save(open);
                    return true;
                }))
                .orElse(false);
    }

    // ==================== Compression ====================

    public CompressionEngine.CompressionResult compress(String chatId, Double targetReduction) {
        double reduction = targetReduction != null ? targetReduction : compressionConfig.getTargetReduction();
        return write(chatId, session -> runCompression(session, reduction));
    }

    public CompressionEngine.Archived restoreArchived(String chatId, Collection<String> nodeIds) {
        return write(chatId, session -> {
            var restored = session.getCompressionEngine().restore(session.getStore(), nodeIds);
            if (!restored.nodes().isEmpty() || !restored.edges().isEmpty()) {
                session.markArchiveDirty();
            }
            return restored;
        });
    }

    public CompressionEngine.ArchiveStats getArchiveStats(String chatId) {
        return readExisting(chatId, session -> session.getCompressionEngine().getArchiveStats());
    }

    public Set<String> getArchivedNodeIds(String chatId) {
        return readExisting(chatId, session -> session.getCompressionEngine().getArchivedNodeIds());
    }

    private void compressIfNeeded(GraphSession session) {
        if (session.getStore().shouldCompress()) {
            log.info("Chat {} reached context threshold {}, compressing",
                    session.getChatId(), session.getStore().getCompressionThreshold());
            runCompression(session, compressionConfig.getTargetReduction());
        }
    }

    private CompressionEngine.CompressionResult runCompression(GraphSession session, double reduction) {
        var result = session.getCompressionEngine().compress(session.getStore(), reduction);
        if (result.archivedNodeCount() > 0) {
            session.markArchiveDirty();
        }
        count(metricsConfig.getNodesArchived(), result.archivedNodeCount());
        return result;
    }

    // ==================== Maintenance ====================

    /**
     * Applies Hebbian decay and then prunes weak edges.
     */
    public MaintenanceResult runMaintenanceCycle(String chatId) {
        return write(chatId, this::decayAndPrune);
    }

    /**
     * Runs a maintenance cycle on every open session without refreshing
     * their last-access time.
     */
    public List<MaintenanceResult> runMaintenanceCycleForAll() {
        var results = new ArrayList<MaintenanceResult>();
        for (GraphSession session : sessionRegistry.findAll()) {
            executeIfOpen(session, true, this::decayAndPrune).ifPresent(results::add);
        }
        return results;
    }

    private MaintenanceResult decayAndPrune(GraphSession session) {
        var store = session.getStore();
        int decayed = hebbianEngine.decay(store);
        int pruned = hebbianEngine.prune(store);

        count(metricsConfig.getDecayCycles(), 1);
        count(metricsConfig.getEdgesPruned(), pruned);
        log.debug("Maintenance cycle for chat {}: decayed={}, pruned={}", session.getChatId(), decayed, pruned);
        return new MaintenanceResult(session.getChatId(), decayed, pruned);
    }

    // ==================== Eviction ====================

    public int evictIdleSessions() {
        long ttlMinutes = retentionConfig.getIdleTtlMinutes();
        if (ttlMinutes <= 0) return 0;
        return evictIdleSessions(Instant.now().minus(Duration.ofMinutes(ttlMinutes)));
    }

    /**
     * Saves and closes every session not accessed since {@code cutoff}.
     */
    public int evictIdleSessions(Instant cutoff) {
        int evicted = 0;
        for (GraphSession session : sessionRegistry.findIdleSince(cutoff)) {
            if (evict(session)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle sessions", evicted);
        }
        return evicted;
    }

    @PreDestroy
    void flushOpenSessions() {
        if (persistenceManager.getGateway().isClosed()) {
            return;
        }
        int saved = 0;
        for (GraphSession session : sessionRegistry.findAll()) {
            if (executeIfOpen(session, false, open -> {
                save(open);
                return true;
            }).isPresent()) {
                saved++;
            }
        }
        log.info("Saved {} open sessions on shutdown", saved);
    }

    private boolean evict(GraphSession session) {
        session.lock();
        try {
            if (session.isClosed()) {
                return false;
            }
            try {
                save(session);
            } catch (RuntimeException e) {
                log.warn("Failed to save session {} before eviction, keeping it open: {}",
                        session.getChatId(), e.getMessage());
                return false;
            }
            return sessionRegistry.remove(session.getChatId());
        } finally {
            session.unlock();
        }
    }

    private void ensureCapacity() {
        if (sessionRegistry.count() < retentionConfig.getMaxSessions()) {
            return;
        }
        sessionRegistry.findLeastRecentlyUsed().ifPresent(session -> {
            if (evict(session)) {
                log.info("Evicted least recently used session {} at capacity {}",
                        session.getChatId(), retentionConfig.getMaxSessions());
            }
        });
    }

    // ==================== Session Access ====================

    /**
     * Runs a read. An unknown chat is answered from an empty graph that is
     * never registered, so lookups with a wrong chat id hold no session slot.
     */
    private <T> T read(String chatId, Function<GraphSession, T> action) {
        requireText(chatId, "chatId");
        if (!sessionExists(chatId)) {
            return action.apply(new GraphSession(new GraphStore(chatId), new CompressionEngine()));
        }
        return execute(chatId, false, action);
    }

    /**
     * Like {@link #read} but never opens a session for an unknown chat.
     */
    private <T> T readExisting(String chatId, Function<GraphSession, T> action) {
        requireText(chatId, "chatId");
        if (!sessionExists(chatId)) {
            throw new SessionNotFoundException(chatId);
        }
        return execute(chatId, false, action);
    }

    private <T> T write(String chatId, Function<GraphSession, T> action) {
        return execute(chatId, true, action);
    }

    private <T> T execute(String chatId, boolean mutating, Function<GraphSession, T> action) {
        requireText(chatId, "chatId");
        while (true) {
            var session = openSession(chatId);
            session.lock();
            try {
                if (session.isClosed()) {
                    continue; // evicted while waiting for the lock
                }
                session.touch();
                T result = action.apply(session);
                if (mutating) {
                    autoSave(session);
                }
                return result;
            } finally {
                session.unlock();
            }
        }
    }

    private <T> Optional<T> executeIfOpen(GraphSession session, boolean mutating, Function<GraphSession, T> action) {
        session.lock();
        try {
            if (session.isClosed()) {
                return Optional.empty();
            }
            T result = action.apply(session);
            if (mutating) {
                autoSave(session);
            }
            return Optional.ofNullable(result);
        } finally {
            session.unlock();
        }
    }

    private GraphSession openSession(String chatId) {
        var existing = sessionRegistry.findById(chatId);
        if (existing.isPresent()) {
            return existing.get();
        }
        ensureCapacity();
        return sessionRegistry.open(chatId, this::loadSession);
    }

    private GraphSession loadSession(String chatId) {
        var compressionEngine = new CompressionEngine();
        persistenceManager.loadArchive(chatId).ifPresent(compressionEngine::loadArchive);
        return new GraphSession(persistenceManager.loadOrCreateGraph(chatId), compressionEngine);
    }

    private void autoSave(GraphSession session) {
        if (weaveConfig.getFeatures().isAutoSave()) {
            save(session);
        }
    }

    private void save(GraphSession session) {
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            persistenceManager.saveGraph(session.getStore().snapshot());
            if (session.isArchiveDirty()) {
                persistenceManager.saveArchive(session.getCompressionEngine().snapshotArchive(session.getChatId()));
                session.clearArchiveDirty();
            }
        } finally {
            sample.stop(metricsConfig.getSnapshotSaveTimer());
        }
    }

    // ==================== Engine Integration ====================

    private List<Edge> link(GraphStore store, Node node) {
        if (!weaveConfig.getFeatures().isSynapticLinkingEnabled()) {
            return List.of();
        }
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            var synapses = useEmbeddings()
                    ? awaitLinks(synapticLinker.linkRetroactivelyEmbedding(node, store))
                    : synapticLinker.linkRetroactively(node, store);
            count(metricsConfig.getSynapsesCreated(), synapses.size());
            return synapses;
        } finally {
            sample.stop(metricsConfig.getLinkingTimer());
        }
    }

    private boolean useEmbeddings() {
        return weaveConfig.getFeatures().isEmbeddingLinkingEnabled() && synapticLinker.hasEmbeddingProvider();
    }

    private static List<Edge> awaitLinks(CompletableFuture<List<Edge>> links) {
        try {
            return links.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void coActivate(GraphStore store, List<Node> results) {
        if (!weaveConfig.getFeatures().isHebbianEnabled() || results.size() < 2) {
            return;
        }
        var strengthened = hebbianEngine.strengthenCoActivated(results.stream().map(Node::id).toList(), store);
        count(metricsConfig.getEdgesStrengthened(), strengthened.size());
    }

    private void count(Counter counter, double amount) {
        if (weaveConfig.getFeatures().isMetricsEnabled() && amount > 0) {
            counter.increment(amount);
        }
    }

    // ==================== Helpers ====================

    private static Node newNode(NodeDraft draft) {
        var node = Node.create(draft.type(), draft.label(), draft.description(), draft.metadata());
        if (draft.id() != null) {
            node = node.withId(draft.id());
        }
        if (draft.frequency() != null) {
            node = node.withFrequency(draft.frequency());
        }
        return node;
    }

    private static Node requireNode(GraphStore store, String nodeId) {
        return store.getNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
