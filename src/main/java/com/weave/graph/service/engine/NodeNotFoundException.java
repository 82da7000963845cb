package com.weave.graph.service.engine;

import lombok.Getter;

/**
 * Thrown when a policy or destructive operation targets a node id the graph does not hold.
 */
@Getter
public class NodeNotFoundException extends RuntimeException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node not found: " + nodeId);
        this.nodeId = nodeId;
    }
}
