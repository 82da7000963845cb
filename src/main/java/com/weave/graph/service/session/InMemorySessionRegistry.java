package com.weave.graph.service.session;

import com.weave.graph.service.config.MetricsConfig;
import com.weave.graph.service.config.RetentionConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of SessionRegistry.
 * Thread-safe; each session guards its own graph with its lock.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemorySessionRegistry implements SessionRegistry {

    private final MetricsConfig metricsConfig;
    private final RetentionConfig retentionConfig;

    private final Map<String, GraphSession> sessions = new ConcurrentHashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        registerMetrics();
        log.info("InMemorySessionRegistry initialized, max sessions: {}", retentionConfig.getMaxSessions());
    }

    private void registerMetrics() {
        metricsConfig.registerStoreGauge(
                "weave.sessions.open.count",
                "Number of sessions held in memory",
                this::count
        );
    }

    // ==================== SessionRegistry Interface ====================

    @Override
    public Optional<GraphSession> findById(String chatId) {
        return Optional.ofNullable(sessions.get(chatId));
    }

    @Override
    public GraphSession open(String chatId, Function<String, GraphSession> loader) {
        return sessions.computeIfAbsent(chatId, id -> {
            var session = loader.apply(id);
            log.info("Session opened: {} (nodes={}, edges={})",
                    id, session.getStore().nodeCount(), session.getStore().edgeCount());
            return session;
        });
    }

    @Override
    public Collection<GraphSession> findAll() {
        return List.copyOf(sessions.values());
    }

    @Override
    public List<GraphSession> findIdleSince(Instant cutoff) {
        return sessions.values().stream()
                .filter(session -> session.getLastAccessedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(GraphSession::getLastAccessedAt))
                .toList();
    }

    @Override
    public Optional<GraphSession> findLeastRecentlyUsed() {
        return sessions.values().stream()
                .min(Comparator.comparing(GraphSession::getLastAccessedAt));
    }

    @Override
    public boolean exists(String chatId) {
        return sessions.containsKey(chatId);
    }

    @Override
    public boolean remove(String chatId) {
        var removed = sessions.remove(chatId);
        if (removed != null) {
            removed.markClosed();
            log.info("Session closed: {}", chatId);
            return true;
        }
        return false;
    }

    @Override
    public int count() {
        return sessions.size();
    }
}
