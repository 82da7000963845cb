package com.weave.graph.service.model;

/**
 * Kinds of knowledge a node can hold.
 */
public enum NodeType {
    CONCEPT,
    DECISION,
    MILESTONE,
    ERROR,
    CORRECTION,
    CODE_ENTITY
}
