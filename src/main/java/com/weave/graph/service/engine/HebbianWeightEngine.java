package com.weave.graph.service.engine;

import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeUpdate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Adjusts edge weights from usage: co-retrieved nodes strengthen the edges
 * between them, everything decays over time, and weak edges are pruned.
 */
@Slf4j
public class HebbianWeightEngine {

    private final HebbianOptions options;

    public HebbianWeightEngine() {
        this(HebbianOptions.defaults());
    }

    public HebbianWeightEngine(HebbianOptions options) {
        this.options = options != null ? options : HebbianOptions.defaults();
    }

    public HebbianOptions getOptions() {
        return options;
    }

    /**
     * Raises the edge weight by the configured strength, capped at maxWeight.
     *
     * @return the updated edge, or empty if the id is unknown
     */
    public Optional<Edge> strengthen(String edgeId, HebbianGraph graph) {
        return graph.getEdge(edgeId).flatMap(edge -> {
            double weight = Math.min(edge.weight() + options.hebbianStrength(), options.maxWeight());
            return graph.updateEdge(edgeId, EdgeUpdate.weight(weight));
        });
    }

    /**
     * Strengthens every edge whose endpoints are both in {@code nodeIds}.
     *
     * @return the strengthened edges; empty for fewer than two ids
     */
    public List<Edge> strengthenCoActivated(Collection<String> nodeIds, HebbianGraph graph) {
        var ids = new HashSet<>(nodeIds);
        if (ids.size() < 2) {
            return List.of();
        }

        var strengthened = new ArrayList<Edge>();
        for (String sourceId : ids) {
            for (Edge edge : graph.getEdgesFrom(sourceId)) {
                if (ids.contains(edge.targetId())) {
                    strengthen(edge.id(), graph).ifPresent(strengthened::add);
                }
            }
        }

        if (!strengthened.isEmpty()) {
            log.debug("Strengthened {} co-activated edges across {} nodes", strengthened.size(), ids.size());
        }
        return strengthened;
    }

    /**
     * Multiplies every edge weight by the decay rate.
     *
     * @return number of edges touched
     */
    public int decay(HebbianGraph graph) {
        int touched = 0;
        for (Edge edge : graph.getAllEdges()) {
            if (graph.updateEdge(edge.id(), EdgeUpdate.weight(edge.weight() * options.decayRate())).isPresent()) {
                touched++;
            }
        }
        return touched;
    }

    public int prune(HebbianGraph graph) {
        return prune(graph, null);
    }

    /**
     * Deletes edges strictly below {@code minWeight}, or below the configured
     * prune threshold when null. An edge exactly at the threshold survives.
     *
     * @return number of edges deleted
     */
    public int prune(HebbianGraph graph, Double minWeight) {
        double threshold = minWeight != null ? minWeight : options.pruneThreshold();
        int pruned = 0;
        for (Edge edge : graph.getAllEdges()) {
            if (edge.weight() < threshold && graph.deleteEdge(edge.id())) {
                pruned++;
            }
        }
        if (pruned > 0) {
            log.debug("Pruned {} edges below weight {}", pruned, threshold);
        }
        return pruned;
    }
}
