package com.weave.graph.service.session;

import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.Node;

import java.util.List;

/**
 * A stored node and the synapse edges created for it.
 *
 * @param created false when an existing node was updated in place
 */
public record NodeResult(Node node, List<Edge> synapses, boolean created) {
}
