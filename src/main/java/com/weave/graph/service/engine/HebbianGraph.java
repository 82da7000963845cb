package com.weave.graph.service.engine;

import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The slice of a graph that {@link HebbianWeightEngine} needs.
 */
public interface HebbianGraph {

    Optional<Edge> getEdge(String edgeId);

    Optional<Edge> updateEdge(String edgeId, EdgeUpdate update);

    Collection<Edge> getAllEdges();

    /**
     * Edges whose source is the given node.
     */
    List<Edge> getEdgesFrom(String nodeId);

    boolean deleteEdge(String edgeId);
}
