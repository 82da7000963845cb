package com.weave.graph.service.session;

/**
 * Outcome of one decay-and-prune cycle over a session.
 */
public record MaintenanceResult(String chatId, int edgesDecayed, int edgesPruned) {
}
