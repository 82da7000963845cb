package com.weave.graph.service.session;

import com.weave.graph.service.config.HebbianConfig;
import com.weave.graph.service.config.RetentionConfig;
import com.weave.graph.service.config.WeaveConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic background work over open sessions: Hebbian decay-and-prune and
 * idle-session eviction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphMaintenanceScheduler {

    private final GraphSessionService sessionService;
    private final WeaveConfig weaveConfig;
    private final HebbianConfig hebbianConfig;
    private final RetentionConfig retentionConfig;

    @PostConstruct
    void init() {
        log.info("Graph maintenance scheduled: hebbian cycle every {}ms, eviction check every {}ms (idle ttl {}min)",
                hebbianConfig.getCycleIntervalMs(),
                retentionConfig.getEvictionIntervalMs(),
                retentionConfig.getIdleTtlMinutes());
    }

    @Scheduled(fixedDelayString = "${weave.hebbian.cycle-interval-ms:300000}",
            initialDelayString = "${weave.hebbian.cycle-interval-ms:300000}")
    public int runHebbianCycle() {
        if (!weaveConfig.getFeatures().isHebbianEnabled()) {
            return 0;
        }
        var results = sessionService.runMaintenanceCycleForAll();
        int pruned = results.stream().mapToInt(MaintenanceResult::edgesPruned).sum();
        if (!results.isEmpty()) {
            log.info("Hebbian cycle over {} sessions, pruned {} edges", results.size(), pruned);
        }
        return results.size();
    }

    @Scheduled(fixedDelayString = "${weave.retention.eviction-interval-ms:60000}")
    public int evictIdleSessions() {
        return sessionService.evictIdleSessions();
    }
}
