package com.weave.graph.service.engine;

/**
 * Thrown when an operation is well-formed but not allowed for the target,
 * e.g. suppressing a node that is not an ERROR.
 */
public class PolicyViolationException extends RuntimeException {

    private final String nodeId;

    public PolicyViolationException(String message, String nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
