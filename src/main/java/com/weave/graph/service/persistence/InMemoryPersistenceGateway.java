package com.weave.graph.service.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed gateway. Values are deep-copied on the way in and out so callers
 * cannot mutate stored state.
 */
@Slf4j
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private final Map<String, JsonNode> store = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    @Override
    public Optional<JsonNode> get(String key) {
        ensureOpen();
        return Optional.ofNullable(store.get(key)).map(JsonNode::deepCopy);
    }

    @Override
    public void set(String key, JsonNode value) {
        ensureOpen();
        store.put(key, value.deepCopy());
    }

    @Override
    public void delete(String key) {
        ensureOpen();
        store.remove(key);
    }

    @Override
    public List<String> list(String prefix) {
        ensureOpen();
        return store.keySet().stream()
                .filter(key -> prefix == null || key.startsWith(prefix))
                .sorted()
                .toList();
    }

    @Override
    public void clear(String prefix) {
        ensureOpen();
        if (prefix == null) {
            store.clear();
        } else {
            store.keySet().removeIf(key -> key.startsWith(prefix));
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            store.clear();
            log.info("In-memory persistence gateway closed");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new GatewayClosedException(getName());
        }
    }
}
