package com.weave.graph.service.model;

/**
 * Semantic relationship carried by an edge.
 */
public enum EdgeType {
    RELATES,
    CAUSES,
    /** Source is a CORRECTION, target the ERROR it corrects. */
    CORRECTS,
    /** Source is a code entity, target the decision it implements. */
    IMPLEMENTS,
    DEPENDS_ON,
    BLOCKS
}
