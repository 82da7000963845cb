package com.weave.graph.service.session;

import com.weave.graph.service.engine.CompressionEngine;
import com.weave.graph.service.engine.GraphStore;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One open chat session: its graph, its compression archive and the lock
 * that serializes access to both.
 */
public class GraphSession {

    private final GraphStore store;
    private final CompressionEngine compressionEngine;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Instant lastAccessedAt;
    private volatile boolean closed = false;
    private boolean archiveDirty = false;

    public GraphSession(GraphStore store, CompressionEngine compressionEngine) {
        this.store = store;
        this.compressionEngine = compressionEngine;
        this.lastAccessedAt = Instant.now();
    }

    /**
     * Runs {@code action} while holding the session lock.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public void touch() {
        lastAccessedAt = Instant.now();
    }

    /**
     * Marks the session as no longer registered. Callers that acquired the
     * lock afterwards must reopen the session.
     */
    void markClosed() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getChatId() {
        return store.getChatId();
    }

    public GraphStore getStore() {
        return store;
    }

    public CompressionEngine getCompressionEngine() {
        return compressionEngine;
    }

    /**
     * Flags the archive as changed since it was last persisted. Guarded by
     * the session lock.
     */
    public void markArchiveDirty() {
        archiveDirty = true;
    }

    public boolean isArchiveDirty() {
        return archiveDirty;
    }

    public void clearArchiveDirty() {
        archiveDirty = false;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }
}
