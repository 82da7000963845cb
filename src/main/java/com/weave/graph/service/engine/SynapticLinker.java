package com.weave.graph.service.engine;

import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeType;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.similarity.Similarity;
import com.weave.graph.service.similarity.TextTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Creates RELATES edges from a newly inserted node to every historical node
 * that is similar enough, at the moment of insertion.
 *
 * Two scoring modes share the same candidate selection: keyword mode uses
 * Jaccard over token sets, embedding mode uses cosine over vectors from an
 * {@link EmbeddingProvider}. Without a provider the embedding entry point
 * falls back to keyword mode.
 */
@Slf4j
public class SynapticLinker {

    public static final String MODE_KEYWORD = "keyword";
    public static final String MODE_EMBEDDING = "embedding";

    private final LinkerOptions options;
    private final EmbeddingProvider embeddingProvider;

    public SynapticLinker() {
        this(LinkerOptions.defaults(), null);
    }

    public SynapticLinker(LinkerOptions options) {
        this(options, null);
    }

    public SynapticLinker(LinkerOptions options, EmbeddingProvider embeddingProvider) {
        this.options = options != null ? options : LinkerOptions.defaults();
        this.embeddingProvider = embeddingProvider;
    }

    public LinkerOptions getOptions() {
        return options;
    }

    public boolean hasEmbeddingProvider() {
        return embeddingProvider != null;
    }

    // ==================== Keyword Mode ====================

    /**
     * Links {@code newNode} to the historical nodes of {@code graph} by token
     * overlap. Returns the created edges, possibly none.
     */
    public List<Edge> linkRetroactively(Node newNode, SynapticGraph graph) {
        var newTokens = TextTokenizer.tokenize(newNode.text());
        if (newTokens.isEmpty()) {
            return List.of();
        }

        var scored = new ArrayList<ScoredCandidate>();
        for (Node candidate : candidates(newNode, graph)) {
            double score = Similarity.jaccard(newTokens, TextTokenizer.tokenize(candidate.text()));
            scored.add(new ScoredCandidate(candidate, score));
        }

        return createEdges(newNode, select(scored), MODE_KEYWORD, graph);
    }

    // ==================== Embedding Mode ====================

    /**
     * Links {@code newNode} by cosine similarity of embeddings. Every node text
     * is embedded concurrently and the batch is awaited before scoring. A
     * provider failure completes the returned future exceptionally and leaves
     * the graph untouched. Candidates without text are never embedded and
     * never linked.
     */
    public CompletableFuture<List<Edge>> linkRetroactivelyEmbedding(Node newNode, SynapticGraph graph) {
        if (embeddingProvider == null) {
            return CompletableFuture.completedFuture(linkRetroactively(newNode, graph));
        }
        if (newNode.text().isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }

        var candidates = candidates(newNode, graph).stream()
                .filter(candidate -> !candidate.text().isBlank())
                .toList();
        if (candidates.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        var newEmbedding = embeddingProvider.embed(newNode.text());
        var candidateEmbeddings = new LinkedHashMap<Node, CompletableFuture<double[]>>();
        candidates.forEach(candidate ->
                candidateEmbeddings.put(candidate, embeddingProvider.embed(candidate.text())));

        var all = new ArrayList<CompletableFuture<double[]>>(candidateEmbeddings.values());
        all.add(newEmbedding);

        return CompletableFuture.allOf(all.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    double[] target = newEmbedding.join();
                    var scored = new ArrayList<ScoredCandidate>();
                    for (Map.Entry<Node, CompletableFuture<double[]>> entry : candidateEmbeddings.entrySet()) {
                        double score = Similarity.cosine(target, entry.getValue().join());
                        scored.add(new ScoredCandidate(entry.getKey(), score));
                    }
                    return createEdges(newNode, select(scored), MODE_EMBEDDING, graph);
                });
    }

    // ==================== Selection ====================

    private List<Node> candidates(Node newNode, SynapticGraph graph) {
        return graph.getAllNodes().stream()
                .filter(node -> !node.id().equals(newNode.id()))
                .toList();
    }

    /**
     * Keeps candidates at or above the threshold, best first, capped at maxConnections.
     * Equal scores keep graph order.
     */
    private List<ScoredCandidate> select(List<ScoredCandidate> scored) {
        return scored.stream()
                .filter(candidate -> candidate.score() >= options.threshold())
                .sorted(Comparator.comparingDouble(ScoredCandidate::score).reversed())
                .limit(options.maxConnections())
                .toList();
    }

    private List<Edge> createEdges(Node newNode, List<ScoredCandidate> selected,
                                   String mode, SynapticGraph graph) {
        var created = new ArrayList<Edge>(selected.size());
        for (ScoredCandidate candidate : selected) {
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("synapse", true);
            metadata.put("similarity", candidate.score());
            metadata.put("mode", mode);

            var edge = Edge.create(newNode.id(), candidate.node().id(), EdgeType.RELATES,
                    candidate.score(), metadata);
            created.add(graph.addEdge(edge));
        }

        if (!created.isEmpty()) {
            log.debug("Linked node {} to {} historical nodes ({} mode)", newNode.id(), created.size(), mode);
        }
        return created;
    }

    /**
     * Similarity metadata of a synapse edge, if the edge was created by a linker.
     */
    public static Optional<Double> synapseSimilarity(Edge edge) {
        if (!Boolean.TRUE.equals(edge.metadata().get("synapse"))) {
            return Optional.empty();
        }
        var similarity = edge.metadata().get("similarity");
        return similarity instanceof Number number ? Optional.of(number.doubleValue()) : Optional.empty();
    }

    private record ScoredCandidate(Node node, double score) {
    }
}
