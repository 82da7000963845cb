package com.weave.graph.service.persistence;

import com.weave.graph.service.engine.GraphStore;
import com.weave.graph.service.model.ArchiveSnapshot;
import com.weave.graph.service.model.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Saves and loads session graphs through a {@link PersistenceGateway}
 * under the {@code graph:<chatId>} key namespace. Compression archives live
 * beside them under {@code archive:<chatId>}.
 */
@Slf4j
public class GraphPersistenceManager {

    public static final String KEY_PREFIX = "graph:";
    public static final String ARCHIVE_KEY_PREFIX = "archive:";

    private final PersistenceGateway gateway;
    private final SnapshotCodec codec;
    private final double defaultCompressionThreshold;

    public GraphPersistenceManager(PersistenceGateway gateway, SnapshotCodec codec) {
        this(gateway, codec, GraphStore.DEFAULT_COMPRESSION_THRESHOLD);
    }

    public GraphPersistenceManager(PersistenceGateway gateway, SnapshotCodec codec,
                                   double defaultCompressionThreshold) {
        this.gateway = gateway;
        this.codec = codec;
        this.defaultCompressionThreshold = defaultCompressionThreshold;
    }

    // ==================== Graph Operations ====================

    public void saveGraph(GraphSnapshot snapshot) {
        gateway.set(keyFor(snapshot.chatId()), codec.encode(snapshot));
        log.debug("Saved graph {} ({} nodes, {} edges)",
                snapshot.chatId(), snapshot.nodes().size(), snapshot.edges().size());
    }

    public Optional<GraphStore> loadGraph(String chatId) {
        return loadSnapshot(chatId).map(GraphStore::restore);
    }

    public Optional<GraphSnapshot> loadSnapshot(String chatId) {
        var key = keyFor(chatId);
        return gateway.get(key).map(json -> codec.decode(key, json));
    }

    /**
     * The persisted graph for {@code chatId}, or a new empty one. A new graph
     * is not saved until the caller saves it.
     */
    public GraphStore loadOrCreateGraph(String chatId) {
        return loadGraph(chatId).orElseGet(() -> {
            log.info("Creating new graph for chat {}", chatId);
            return new GraphStore(chatId, defaultCompressionThreshold);
        });
    }

    public boolean graphExists(String chatId) {
        return gateway.get(keyFor(chatId)).isPresent();
    }

    /**
     * Deletes the graph and its archive.
     *
     * @return true if a graph was stored for {@code chatId}
     */
    public boolean deleteGraph(String chatId) {
        boolean existed = graphExists(chatId);
        gateway.delete(keyFor(chatId));
        gateway.delete(archiveKeyFor(chatId));
        if (existed) {
            log.info("Deleted graph for chat {}", chatId);
        }
        return existed;
    }

    // ==================== Archive Operations ====================

    /**
     * Stores the archive, or removes the stored one when the archive is empty.
     */
    public void saveArchive(ArchiveSnapshot archive) {
        var key = archiveKeyFor(archive.chatId());
        if (archive.isEmpty()) {
            gateway.delete(key);
            return;
        }
        gateway.set(key, codec.encodeArchive(archive));
        log.debug("Saved archive {} ({} nodes, {} edges)",
                archive.chatId(), archive.nodes().size(), archive.edges().size());
    }

    public Optional<ArchiveSnapshot> loadArchive(String chatId) {
        var key = archiveKeyFor(chatId);
        return gateway.get(key).map(json -> codec.decodeArchive(key, json));
    }

    // ==================== Listing ====================

    public List<String> listChatIds() {
        return gateway.list(KEY_PREFIX).stream()
                .map(key -> key.substring(KEY_PREFIX.length()))
                .toList();
    }

    /**
     * Summaries of every persisted session, read from their snapshots.
     */
    public List<SessionSummary> listSessions() {
        var summaries = new ArrayList<SessionSummary>();
        for (String chatId : listChatIds()) {
            loadSnapshot(chatId).ifPresent(snapshot -> summaries.add(SessionSummary.of(snapshot)));
        }
        return summaries;
    }

    public PersistenceGateway getGateway() {
        return gateway;
    }

    public static String keyFor(String chatId) {
        return KEY_PREFIX + chatId;
    }

    public static String archiveKeyFor(String chatId) {
        return ARCHIVE_KEY_PREFIX + chatId;
    }

    /**
     * Listing entry for one persisted session.
     */
    public record SessionSummary(
            String chatId,
            Instant createdAt,
            Instant updatedAt,
            int nodeCount,
            int edgeCount
    ) {
        static SessionSummary of(GraphSnapshot snapshot) {
            var metadata = snapshot.metadata();
            return new SessionSummary(metadata.chatId(), metadata.createdAt(), metadata.updatedAt(),
                    snapshot.nodes().size(), snapshot.edges().size());
        }
    }
}
