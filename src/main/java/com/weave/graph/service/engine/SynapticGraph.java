package com.weave.graph.service.engine;

import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.Node;

import java.util.Collection;

/**
 * The slice of a graph that {@link SynapticLinker} needs.
 */
public interface SynapticGraph {

    Collection<Node> getAllNodes();

    Edge addEdge(Edge edge);
}
