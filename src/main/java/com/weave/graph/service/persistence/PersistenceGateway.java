package com.weave.graph.service.persistence;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Key-value storage backend for serialized snapshots.
 *
 * Keys are namespaced by the caller (e.g. {@code graph:<chatId>}). A reader
 * never observes a partially written value. Every operation on a closed
 * gateway fails with {@link GatewayClosedException}.
 */
public interface PersistenceGateway extends AutoCloseable {

    /**
     * @return the stored value, or empty if the key is absent
     */
    Optional<JsonNode> get(String key);

    /**
     * Stores or replaces the value under {@code key}.
     */
    void set(String key, JsonNode value);

    /**
     * Removes the key. Missing keys are ignored.
     */
    void delete(String key);

    /**
     * Keys starting with {@code prefix}, sorted. A null prefix lists everything.
     */
    List<String> list(String prefix);

    default List<String> list() {
        return list(null);
    }

    /**
     * Removes every key starting with {@code prefix}. A null prefix removes everything.
     */
    void clear(String prefix);

    default void clear() {
        clear(null);
    }

    boolean isClosed();

    /**
     * Short backend name for logs and health details.
     */
    String getName();

    @Override
    void close();
}
