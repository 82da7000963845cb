package com.weave.graph.service.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weave.graph.service.config.CompressionConfig;
import com.weave.graph.service.config.MetricsConfig;
import com.weave.graph.service.config.RetentionConfig;
import com.weave.graph.service.config.WeaveConfig;
import com.weave.graph.service.engine.ErrorSuppression;
import com.weave.graph.service.engine.HebbianWeightEngine;
import com.weave.graph.service.engine.LinkerOptions;
import com.weave.graph.service.engine.NodeNotFoundException;
import com.weave.graph.service.engine.PolicyViolationException;
import com.weave.graph.service.engine.SynapticLinker;
import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeType;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.model.NodeType;
import com.weave.graph.service.model.NodeUpdate;
import com.weave.graph.service.persistence.GraphPersistenceManager;
import com.weave.graph.service.persistence.InMemoryPersistenceGateway;
import com.weave.graph.service.persistence.SnapshotCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GraphSessionServiceTest {

    private static final String CHAT = "chat-42";

    private GraphPersistenceManager persistenceManager;
    private InMemorySessionRegistry registry;
    private MetricsConfig metricsConfig;
    private WeaveConfig weaveConfig;
    private RetentionConfig retentionConfig;
    private GraphSessionService service;

    @BeforeEach
    void setUp() {
        var objectMapper = new ObjectMapper();
        persistenceManager = new GraphPersistenceManager(
                new InMemoryPersistenceGateway(), new SnapshotCodec(objectMapper));
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        weaveConfig = new WeaveConfig();
        retentionConfig = new RetentionConfig();
        registry = new InMemorySessionRegistry(metricsConfig, retentionConfig);
        service = newService(registry);
    }

    private GraphSessionService newService(InMemorySessionRegistry sessionRegistry) {
        return new GraphSessionService(
                sessionRegistry,
                persistenceManager,
                new SynapticLinker(new LinkerOptions(0.2, 20)),
                new HebbianWeightEngine(),
                weaveConfig,
                new CompressionConfig(),
                retentionConfig,
                metricsConfig);
    }

    private Node save(NodeType type, String label) {
        return service.saveNode(CHAT, NodeDraft.builder().type(type).label(label).build()).node();
    }

    // ==================== Nodes ====================

    @Test
    @DisplayName("A new node similar to an existing one gets a synapse edge")
    void saveNodeLinksRetroactively() {
        var first = save(NodeType.CONCEPT, "TypeScript generics");

        var result = service.saveNode(CHAT, NodeDraft.builder()
                .type(NodeType.CONCEPT).label("TypeScript generic types").build());

        assertThat(result.created()).isTrue();
        assertThat(result.synapses()).singleElement().satisfies(edge -> {
            assertThat(edge.sourceId()).isEqualTo(result.node().id());
            assertThat(edge.targetId()).isEqualTo(first.id());
        });
        assertThat(metricsConfig.getSynapsesCreated().count()).isEqualTo(1.0);
        assertThat(metricsConfig.getNodesAdded().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Saving an existing id updates it in place without linking")
    void saveNodeUpserts() {
        var created = service.saveNode(CHAT, NodeDraft.builder()
                .id("n1").type(NodeType.CONCEPT).label("Original").frequency(4).build());

        var updated = service.saveNode(CHAT, NodeDraft.builder()
                .id("n1").type(NodeType.DECISION).label("Renamed").frequency(9).build());

        assertThat(created.created()).isTrue();
        assertThat(updated.created()).isFalse();
        assertThat(updated.synapses()).isEmpty();
        assertThat(updated.node().label()).isEqualTo("Renamed");
        assertThat(updated.node().type()).isEqualTo(NodeType.DECISION);
        assertThat(updated.node().frequency()).isEqualTo(4);
    }

    @Test
    void saveNodeRequiresLabelAndType() {
        assertThatThrownBy(() -> service.saveNode(CHAT, NodeDraft.builder().type(NodeType.CONCEPT).label(" ").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.saveNode(CHAT, NodeDraft.builder().label("x").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updateIncrementAndDeleteNode() {
        var node = save(NodeType.CONCEPT, "Circuit breaker");

        assertThat(service.updateNode(CHAT, node.id(), NodeUpdate.builder().description("resilience").build()))
                .hasValueSatisfying(n -> assertThat(n.description()).isEqualTo("resilience"));
        assertThat(service.incrementFrequency(CHAT, node.id())).map(Node::frequency).contains(2);
        assertThat(service.deleteNode(CHAT, node.id())).isTrue();
        assertThat(service.getNode(CHAT, node.id())).isEmpty();
    }

    // ==================== Edges ====================

    @Test
    void addEdgeRequiresBothEndpoints() {
        var a = save(NodeType.CONCEPT, "alpha");

        assertThatThrownBy(() -> service.addEdge(CHAT, EdgeDraft.builder()
                .sourceId(a.id()).targetId("missing").type(EdgeType.CAUSES).build()))
                .isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void addEdgeAndReadBothDirections() {
        var a = save(NodeType.CONCEPT, "alpha");
        var b = save(NodeType.CONCEPT, "omega");

        var edge = service.addEdge(CHAT, EdgeDraft.builder()
                .sourceId(a.id()).targetId(b.id()).type(EdgeType.BLOCKS).weight(2.5).build());

        assertThat(edge.weight()).isEqualTo(2.5);
        assertThat(service.getEdgesFrom(CHAT, a.id())).containsExactly(edge);
        assertThat(service.getEdgesTo(CHAT, b.id())).containsExactly(edge);
        assertThat(service.queryEdgesByType(CHAT, EdgeType.BLOCKS)).containsExactly(edge);
        assertThat(service.deleteEdge(CHAT, edge.id())).isTrue();
        assertThat(service.getEdge(CHAT, edge.id())).isEmpty();
    }

    // ==================== Queries ====================

    @Test
    @DisplayName("Querying strengthens edges among every matched node")
    void queryGraphStrengthensCoActivatedEdges() {
        save(NodeType.CONCEPT, "TypeScript generics");
        save(NodeType.CONCEPT, "TypeScript generic types");
        var synapse = service.queryEdgesByType(CHAT, EdgeType.RELATES).get(0);
        double before = synapse.weight();

        var results = service.queryGraph(CHAT, "typescript", 1);

        assertThat(results).hasSize(1);
        assertThat(service.getEdge(CHAT, synapse.id()).orElseThrow().weight())
                .isCloseTo(before + 0.1, within(1e-9));
        assertThat(metricsConfig.getEdgesStrengthened().count()).isEqualTo(1.0);
    }

    @Test
    void queryWithHebbianDisabledLeavesWeights() {
        weaveConfig.getFeatures().setHebbianEnabled(false);
        save(NodeType.CONCEPT, "TypeScript generics");
        save(NodeType.CONCEPT, "TypeScript generic types");
        var synapse = service.queryEdgesByType(CHAT, EdgeType.RELATES).get(0);

        service.queryByType(CHAT, NodeType.CONCEPT);

        assertThat(service.getEdge(CHAT, synapse.id()).orElseThrow().weight()).isEqualTo(synapse.weight());
    }

    @Test
    void listOrphans() {
        var lonely = save(NodeType.CONCEPT, "zebra");
        save(NodeType.CONCEPT, "TypeScript generics");
        save(NodeType.CONCEPT, "TypeScript generic types");

        assertThat(service.listOrphans(CHAT)).containsExactly(lonely);
    }

    // ==================== Errors ====================

    @Test
    @DisplayName("Suppressing an unknown id creates the error node and its correction")
    void suppressErrorCreatesMissingErrorNode() {
        var result = service.suppressError(CHAT, "err-1", "fix", "details");

        assertThat(result.error().id()).isEqualTo("err-1");
        assertThat(result.error().type()).isEqualTo(NodeType.ERROR);
        assertThat(ErrorSuppression.isSuppressed(result.error())).isTrue();
        assertThat(result.correction().label()).isEqualTo(GraphSessionService.CORRECTION_LABEL_PREFIX + "fix");
        assertThat(result.correction().description()).isEqualTo("details");
        assertThat(service.findUncorrectedErrors(CHAT)).isEmpty();
        assertThat(service.findCorrectedErrors(CHAT)).containsOnlyKeys("err-1");
        assertThat(metricsConfig.getErrorsSuppressed().count()).isEqualTo(1.0);
    }

    @Test
    void suppressingNonErrorIsRejected() {
        var concept = save(NodeType.CONCEPT, "Idempotency");

        assertThatThrownBy(() -> service.suppressError(CHAT, concept.id(), "fix", null))
                .isInstanceOf(PolicyViolationException.class);
    }

    @Test
    void uncorrectedErrorsAreListed() {
        var error = save(NodeType.ERROR, "Deadlock in scheduler");

        assertThat(service.findUncorrectedErrors(CHAT)).containsExactly(error);
    }

    // ==================== Milestones ====================

    @Test
    @DisplayName("Next action is the first milestone not marked DONE")
    void milestonesDriveNextAction() {
        var design = save(NodeType.MILESTONE, "Design API");
        var build = save(NodeType.MILESTONE, "Build API");

        assertThat(service.getNextAction(CHAT)).map(Node::id).contains(design.id());

        var done = service.updateMilestone(CHAT, design.id(), GraphSessionService.STATUS_DONE, 3.5);

        assertThat(done.metadata())
                .containsEntry(GraphSessionService.MILESTONE_STATUS, "DONE")
                .containsEntry(GraphSessionService.MILESTONE_ACTUAL_HOURS, 3.5);
        assertThat(service.getNextAction(CHAT)).map(Node::id).contains(build.id());

        service.updateMilestone(CHAT, build.id(), "DONE", null);
        assertThat(service.getNextAction(CHAT)).isEmpty();
    }

    @Test
    void updateMilestoneRejectsOtherTypes() {
        var concept = save(NodeType.CONCEPT, "not a milestone");

        assertThatThrownBy(() -> service.updateMilestone(CHAT, concept.id(), "DONE", 1.0))
                .isInstanceOf(PolicyViolationException.class);
        assertThatThrownBy(() -> service.updateMilestone(CHAT, "nope", "DONE", 1.0))
                .isInstanceOf(NodeNotFoundException.class);
    }

    // ==================== Session Lifecycle ====================

    @Test
    @DisplayName("Mutations are auto-saved and survive eviction")
    void autoSaveAndReload() {
        var node = save(NodeType.DECISION, "Adopt gRPC");
        assertThat(persistenceManager.graphExists(CHAT)).isTrue();

        assertThat(service.evictIdleSessions(Instant.now().plusSeconds(60))).isEqualTo(1);
        assertThat(registry.exists(CHAT)).isFalse();

        assertThat(service.getNode(CHAT, node.id())).contains(node);
        assertThat(registry.exists(CHAT)).isTrue();
    }

    @Test
    void withoutAutoSaveNothingIsPersistedUntilSaved() {
        weaveConfig.getFeatures().setAutoSave(false);
        save(NodeType.CONCEPT, "draft");
        assertThat(persistenceManager.graphExists(CHAT)).isFalse();

        assertThat(service.saveSession(CHAT)).isTrue();
        assertThat(persistenceManager.graphExists(CHAT)).isTrue();
        assertThat(service.saveSession("not-open")).isFalse();
    }

    @Test
    void listAndDeleteSessions() {
        save(NodeType.CONCEPT, "a");
        service.saveNode("other", NodeDraft.builder().type(NodeType.CONCEPT).label("b").build());

        assertThat(service.listSessions())
                .extracting(GraphPersistenceManager.SessionSummary::chatId)
                .containsExactly(CHAT, "other");

        assertThat(service.deleteSession("other")).isTrue();
        assertThat(service.sessionExists("other")).isFalse();
        assertThat(service.deleteSession("other")).isFalse();
    }

    @Test
    @DisplayName("Opening a session beyond capacity evicts the least recently used one")
    void capacityEvictsLeastRecentlyUsed() {
        retentionConfig.setMaxSessions(1);
        save(NodeType.CONCEPT, "first session");

        service.saveNode("second", NodeDraft.builder().type(NodeType.CONCEPT).label("x").build());

        assertThat(registry.exists(CHAT)).isFalse();
        assertThat(registry.exists("second")).isTrue();
        assertThat(persistenceManager.graphExists(CHAT)).isTrue();
    }

    @Test
    @DisplayName("Reading an unknown chat fails without opening a session")
    void readsOfUnknownChatDoNotOpenSessions() {
        assertThatThrownBy(() -> service.getStats("typo-chat")).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> service.exportSnapshot("typo-chat")).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> service.getSessionContext("typo-chat")).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> service.getArchiveStats("typo-chat")).isInstanceOf(SessionNotFoundException.class);
        assertThat(service.getNode("typo-chat", "n1")).isEmpty();
        assertThat(service.listOrphans("typo-chat")).isEmpty();
        assertThat(service.getNextAction("typo-chat")).isEmpty();

        assertThat(registry.exists("typo-chat")).isFalse();
        assertThat(registry.count()).isZero();
        assertThat(persistenceManager.graphExists("typo-chat")).isFalse();
    }

    @Test
    void readsOfPersistedChatReopenIt() {
        save(NodeType.CONCEPT, "persisted");
        service.evictIdleSessions(Instant.now().plusSeconds(60));

        assertThat(service.getStats(CHAT).totalNodes()).isEqualTo(1);
        assertThat(registry.exists(CHAT)).isTrue();
    }

    @Test
    void sessionContextReportsTopNodesAndErrors() {
        save(NodeType.ERROR, "Flaky test");
        var hot = service.saveNode(CHAT, NodeDraft.builder()
                .type(NodeType.CONCEPT).label("Hot path").frequency(10).build()).node();

        var context = service.getSessionContext(CHAT);

        assertThat(context.chatId()).isEqualTo(CHAT);
        assertThat(context.stats().totalNodes()).isEqualTo(2);
        assertThat(context.topNodes().get(0)).isEqualTo(hot);
        assertThat(context.uncorrectedErrors()).isEqualTo(1);
        assertThat(context.shouldCompress()).isFalse();
        assertThat(context.contextSizeBytes()).isPositive();
    }

    // ==================== Compression & Maintenance ====================

    @Test
    void compressAndRestoreThroughService() {
        var keep = save(NodeType.CONCEPT, "keep me");
        var weak = save(NodeType.ERROR, "forget me");
        service.incrementFrequency(CHAT, keep.id());
        assertThat(service.queryGraph(CHAT, "keep", 5)).containsExactly(service.getNode(CHAT, keep.id()).orElseThrow());

        var result = service.compress(CHAT, 0.5);

        assertThat(result.archivedNodeCount()).isEqualTo(1);
        assertThat(service.getArchivedNodeIds(CHAT)).containsExactly(weak.id());
        assertThat(service.getNode(CHAT, weak.id())).isEmpty();

        var restored = service.restoreArchived(CHAT, List.of(weak.id()));
        assertThat(restored.nodes()).extracting(Node::id).containsExactly(weak.id());
        assertThat(service.getArchiveStats(CHAT).archivedNodes()).isZero();
    }

    @Test
    @DisplayName("Archived nodes survive eviction and can be restored after reopening")
    void archiveSurvivesEviction() {
        save(NodeType.CONCEPT, "keep me");
        var weak = save(NodeType.ERROR, "forget me");
        service.compress(CHAT, 0.5);

        assertThat(service.evictIdleSessions(Instant.now().plusSeconds(5))).isEqualTo(1);
        assertThat(registry.exists(CHAT)).isFalse();

        assertThat(service.getArchivedNodeIds(CHAT)).containsExactly(weak.id());
        var restored = service.restoreArchived(CHAT, List.of(weak.id()));

        assertThat(restored.nodes()).extracting(Node::id).containsExactly(weak.id());
        assertThat(service.getNode(CHAT, weak.id())).isPresent();
        assertThat(persistenceManager.loadArchive(CHAT)).isEmpty();
    }

    @Test
    @DisplayName("Eviction persists the archive even with auto-save off")
    void archiveIsSavedOnEvictionWithoutAutoSave() {
        weaveConfig.getFeatures().setAutoSave(false);
        save(NodeType.CONCEPT, "keep me");
        var weak = save(NodeType.ERROR, "forget me");
        service.compress(CHAT, 0.5);
        assertThat(persistenceManager.loadArchive(CHAT)).isEmpty();

        service.evictIdleSessions(Instant.now().plusSeconds(5));

        assertThat(persistenceManager.loadArchive(CHAT))
                .hasValueSatisfying(archive -> assertThat(archive.nodes()).containsOnlyKeys(weak.id()));
        assertThat(service.getArchiveStats(CHAT).archivedNodes()).isEqualTo(1);
    }

    @Test
    void archiveIsRestoredByAFreshServiceInstance() {
        var keep = save(NodeType.CONCEPT, "keep me");
        var weak = save(NodeType.ERROR, "forget me");
        service.addEdge(CHAT, EdgeDraft.builder().sourceId(keep.id()).targetId(weak.id())
                .type(EdgeType.CAUSES).weight(1.0).build());
        service.compress(CHAT, 0.5);

        var restarted = newService(new InMemorySessionRegistry(metricsConfig, retentionConfig));
        var restored = restarted.restoreArchived(CHAT, List.of(weak.id()));

        assertThat(restored.nodes()).extracting(Node::id).containsExactly(weak.id());
        assertThat(restored.edges()).extracting(Edge::type).contains(EdgeType.CAUSES);
        assertThat(restarted.getEdgesFrom(CHAT, keep.id()))
                .anySatisfy(edge -> assertThat(edge.targetId()).isEqualTo(weak.id()));
    }

    @Test
    void deletingSessionDeletesItsArchive() {
        save(NodeType.CONCEPT, "keep me");
        save(NodeType.ERROR, "forget me");
        service.compress(CHAT, 0.5);
        assertThat(persistenceManager.loadArchive(CHAT)).isPresent();

        assertThat(service.deleteSession(CHAT)).isTrue();

        assertThat(persistenceManager.loadArchive(CHAT)).isEmpty();
    }

    @Test
    @DisplayName("A maintenance cycle decays every edge and prunes the weak ones")
    void maintenanceCycleDecaysAndPrunes() {
        var a = save(NodeType.CONCEPT, "alpha");
        var b = save(NodeType.CONCEPT, "omega");
        service.addEdge(CHAT, EdgeDraft.builder().sourceId(a.id()).targetId(b.id())
                .type(EdgeType.RELATES).weight(0.0505).build());
        service.addEdge(CHAT, EdgeDraft.builder().sourceId(b.id()).targetId(a.id())
                .type(EdgeType.RELATES).weight(1.0).metadata(Map.of("note", "strong")).build());

        var result = service.runMaintenanceCycle(CHAT);

        assertThat(result.edgesDecayed()).isEqualTo(2);
        assertThat(result.edgesPruned()).isEqualTo(1);
        assertThat(service.getStats(CHAT).totalEdges()).isEqualTo(1);
        assertThat(service.runMaintenanceCycleForAll()).hasSize(1);
    }
}
