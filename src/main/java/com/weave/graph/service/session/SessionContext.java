package com.weave.graph.service.session;

import com.weave.graph.service.engine.CompressionEngine.ArchiveStats;
import com.weave.graph.service.model.GraphStats;
import com.weave.graph.service.model.Node;

import java.util.List;

/**
 * What an agent needs to resume a session: graph statistics, context-size
 * pressure and the most frequently used nodes.
 */
public record SessionContext(
        String chatId,
        GraphStats stats,
        long contextSizeBytes,
        double contextUsage,
        boolean shouldCompress,
        List<Node> topNodes,
        int uncorrectedErrors,
        ArchiveStats archive
) {
}
