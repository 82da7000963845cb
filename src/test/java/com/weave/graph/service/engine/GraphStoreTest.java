package com.weave.graph.service.engine;

import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeType;
import com.weave.graph.service.model.EdgeUpdate;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.model.NodeType;
import com.weave.graph.service.model.NodeUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GraphStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private GraphStore store;

    @BeforeEach
    void setUp() {
        store = new GraphStore("chat-1", GraphStore.DEFAULT_COMPRESSION_THRESHOLD, CLOCK);
    }

    // ==================== Nodes ====================

    @Test
    void addAndGetNode() {
        var node = store.addNode(Node.concept("Dependency Injection", "Spring wiring"));

        assertThat(store.getNode(node.id())).contains(node);
        assertThat(store.nodeCount()).isEqualTo(1);
        assertThat(store.getNode("missing")).isEmpty();
    }

    @Test
    @DisplayName("Updating a label moves the node to its new label bucket")
    void updateNodeReindexesLabel() {
        var node = store.addNode(Node.concept("Old Name", null));

        var updated = store.updateNode(node.id(), NodeUpdate.builder().label("Fresh Name").build());

        assertThat(updated).isPresent();
        assertThat(updated.get().label()).isEqualTo("Fresh Name");
        assertThat(store.queryByLabel("old")).isEmpty();
        assertThat(store.queryByLabel("fresh")).extracting(Node::id).containsExactly(node.id());
    }

    @Test
    void updateNodeReindexesType() {
        var node = store.addNode(Node.concept("Retry policy", null));

        store.updateNode(node.id(), NodeUpdate.builder().type(NodeType.DECISION).build());

        assertThat(store.queryByType(NodeType.CONCEPT)).isEmpty();
        assertThat(store.queryByType(NodeType.DECISION)).extracting(Node::id).containsExactly(node.id());
    }

    @Test
    void updateUnknownNodeReturnsEmpty() {
        assertThat(store.updateNode("nope", NodeUpdate.builder().label("x").build())).isEmpty();
        assertThat(store.incrementFrequency("nope")).isEmpty();
    }

    @Test
    void incrementFrequency() {
        var node = store.addNode(Node.concept("Caching", null));

        store.incrementFrequency(node.id());
        var bumped = store.incrementFrequency(node.id());

        assertThat(bumped).map(Node::frequency).contains(3);
    }

    @Test
    @DisplayName("Deleting a node removes every edge touching it")
    void deleteNodeCascadesEdges() {
        var a = store.addNode(Node.concept("A", null));
        var b = store.addNode(Node.concept("B", null));
        var c = store.addNode(Node.concept("C", null));
        store.addEdge(Edge.relates(a.id(), b.id(), 1.0));
        store.addEdge(Edge.relates(c.id(), a.id(), 1.0));
        var kept = store.addEdge(Edge.relates(b.id(), c.id(), 1.0));

        assertThat(store.deleteNode(a.id())).isTrue();

        assertThat(store.getAllEdges()).containsExactly(kept);
        assertThat(store.getEdgesFrom(a.id())).isEmpty();
        assertThat(store.getEdgesTo(a.id())).isEmpty();
        assertThat(store.getEdgesTo(b.id())).isEmpty();
        assertThat(store.deleteNode(a.id())).isFalse();
    }

    // ==================== Edges ====================

    @Test
    void edgesAreIndexedBySourceTargetAndType() {
        var a = store.addNode(Node.concept("A", null));
        var b = store.addNode(Node.concept("B", null));
        var edge = store.addEdge(Edge.causes(a.id(), b.id(), 2.0));

        assertThat(store.getEdgesFrom(a.id())).containsExactly(edge);
        assertThat(store.getEdgesTo(b.id())).containsExactly(edge);
        assertThat(store.queryEdgesByType(EdgeType.CAUSES)).containsExactly(edge);
        assertThat(store.queryEdgesByType(EdgeType.RELATES)).isEmpty();
    }

    @Test
    void updateEdgeTypeMovesTypeIndex() {
        var a = store.addNode(Node.concept("A", null));
        var b = store.addNode(Node.concept("B", null));
        var edge = store.addEdge(Edge.relates(a.id(), b.id(), 1.0));

        var updated = store.updateEdge(edge.id(), EdgeUpdate.builder().type(EdgeType.BLOCKS).weight(0.5).build());

        assertThat(updated).isPresent();
        assertThat(updated.get().weight()).isEqualTo(0.5);
        assertThat(store.queryEdgesByType(EdgeType.RELATES)).isEmpty();
        assertThat(store.queryEdgesByType(EdgeType.BLOCKS)).extracting(Edge::id).containsExactly(edge.id());
    }

    @Test
    void deleteEdge() {
        var a = store.addNode(Node.concept("A", null));
        var b = store.addNode(Node.concept("B", null));
        var edge = store.addEdge(Edge.relates(a.id(), b.id(), 1.0));

        assertThat(store.deleteEdge(edge.id())).isTrue();
        assertThat(store.deleteEdge(edge.id())).isFalse();
        assertThat(store.getEdgesFrom(a.id())).isEmpty();
        assertThat(store.edgeCount()).isZero();
    }

    // ==================== Queries ====================

    @Test
    @DisplayName("Label query is a case-insensitive substring match, most frequent first")
    void queryByLabelOrdersByFrequency() {
        var rare = store.addNode(Node.concept("Kafka consumer", null));
        var common = store.addNode(Node.concept("KAFKA producer", null).withFrequency(5));
        store.addNode(Node.concept("RabbitMQ", null));

        assertThat(store.queryByLabel("kafka")).extracting(Node::id).containsExactly(common.id(), rare.id());
        assertThat(store.queryByLabel("zookeeper")).isEmpty();
    }

    @Test
    void statsCountByType() {
        var a = store.addNode(Node.concept("A", null));
        var e = store.addNode(Node.error("E", null));
        store.addEdge(Edge.relates(a.id(), e.id(), 1.0));

        var stats = store.getStats();

        assertThat(stats.chatId()).isEqualTo("chat-1");
        assertThat(stats.totalNodes()).isEqualTo(2);
        assertThat(stats.totalEdges()).isEqualTo(1);
        assertThat(stats.nodesByType()).containsEntry(NodeType.CONCEPT, 1).containsEntry(NodeType.ERROR, 1);
        assertThat(stats.edgesByType()).containsOnly(Map.entry(EdgeType.RELATES, 1));
    }

    // ==================== Collaborators ====================

    @Test
    @DisplayName("An attached linker links every added node")
    void attachedLinkerLinksOnAdd() {
        store.attachSynapticLinker(new SynapticLinker(LinkerOptions.defaults().withThreshold(0.2)));
        var first = store.addNode(Node.concept("TypeScript generics", null));
        var second = store.addNode(Node.concept("TypeScript generic types", null));

        assertThat(store.getEdgesFrom(second.id()))
                .singleElement()
                .satisfies(edge -> {
                    assertThat(edge.targetId()).isEqualTo(first.id());
                    assertThat(edge.type()).isEqualTo(EdgeType.RELATES);
                });
    }

    @Test
    void reinsertNodeNeverLinks() {
        store.attachSynapticLinker(new SynapticLinker(LinkerOptions.defaults().withThreshold(0.0)));
        store.addNode(Node.concept("alpha beta", null));
        store.reinsertNode(Node.concept("alpha beta", null));

        assertThat(store.edgeCount()).isZero();
    }

    @Test
    @DisplayName("An attached Hebbian engine strengthens edges among co-retrieved nodes")
    void attachedHebbianEngineStrengthensOnQuery() {
        store.attachHebbianEngine(new HebbianWeightEngine());
        var a = store.addNode(Node.concept("queue reader", null));
        var b = store.addNode(Node.concept("queue writer", null));
        var edge = store.addEdge(Edge.relates(a.id(), b.id(), 1.0));

        store.queryByLabel("queue");

        assertThat(store.getEdge(edge.id())).map(Edge::weight).hasValueSatisfying(
                weight -> assertThat(weight).isCloseTo(1.1, within(1e-9)));
        assertThat(store.getHebbianEngine()).isPresent();
        assertThat(store.getSynapticLinker()).isEmpty();
    }

    @Test
    void attachedHebbianEngineStrengthensOnTypeQuery() {
        store.attachHebbianEngine(new HebbianWeightEngine());
        var first = store.addNode(Node.milestone("Design schema", null));
        var second = store.addNode(Node.milestone("Ship migration", null));
        var other = store.addNode(Node.concept("Schema registry", null));
        var inside = store.addEdge(Edge.relates(first.id(), second.id(), 1.0));
        var outside = store.addEdge(Edge.relates(first.id(), other.id(), 1.0));

        assertThat(store.queryByType(NodeType.MILESTONE)).containsExactly(first, second);

        assertThat(store.getEdge(inside.id()).get().weight()).isCloseTo(1.1, within(1e-9));
        assertThat(store.getEdge(outside.id()).get().weight()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Without a Hebbian engine queries never change edge weights")
    void queriesWithoutHebbianEngineLeaveWeights() {
        var a = store.addNode(Node.concept("queue reader", null));
        var b = store.addNode(Node.concept("queue writer", null));
        var edge = store.addEdge(Edge.relates(a.id(), b.id(), 1.0));
        var before = store.getEdge(edge.id()).orElseThrow();

        store.queryByLabel("queue");
        store.queryByType(NodeType.CONCEPT);
        store.queryByLabel("queue");

        assertThat(store.getHebbianEngine()).isEmpty();
        assertThat(store.getEdge(edge.id())).contains(before);
    }

    // ==================== Snapshot ====================

    @Test
    @DisplayName("Snapshot and restore preserve records and metadata")
    void snapshotRestoreRoundTrip() {
        var a = store.addNode(Node.concept("A", "first"));
        var b = store.addNode(Node.milestone("B", null));
        var edge = store.addEdge(Edge.dependsOn(b.id(), a.id()));

        var snapshot = store.snapshot();
        var restored = GraphStore.restore(snapshot, CLOCK);

        assertThat(restored.getChatId()).isEqualTo("chat-1");
        assertThat(restored.getCompressionThreshold()).isEqualTo(0.75);
        assertThat(restored.getAllNodes()).containsExactly(a, b);
        assertThat(restored.getEdgesFrom(b.id())).containsExactly(edge);
        assertThat(restored.queryByType(NodeType.MILESTONE)).containsExactly(b);
        assertThat(restored.getCreatedAt()).isEqualTo(store.getCreatedAt());
        assertThat(snapshot.metadata().version()).isEqualTo(GraphStore.VERSION);
    }

    @Test
    void clearRemovesEverything() {
        var a = store.addNode(Node.concept("A", null));
        var b = store.addNode(Node.concept("B", null));
        store.addEdge(Edge.relates(a.id(), b.id(), 1.0));

        store.clear();

        assertThat(store.nodeCount()).isZero();
        assertThat(store.edgeCount()).isZero();
        assertThat(store.queryByLabel("a")).isEmpty();
    }

    @Test
    void emptyStoreDoesNotNeedCompression() {
        assertThat(store.getContextWindowUsage()).isZero();
        assertThat(store.shouldCompress()).isFalse();
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> new GraphStore("c", 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GraphStore("c", 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
