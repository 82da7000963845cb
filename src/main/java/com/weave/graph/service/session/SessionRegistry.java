package com.weave.graph.service.session;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Interface for the registry of open sessions.
 *
 * Holds the in-memory working set; persistence is the session service's concern.
 */
public interface SessionRegistry {

    /**
     * Retrieves an open session.
     *
     * @param chatId the chat identifier
     * @return the session if open
     */
    Optional<GraphSession> findById(String chatId);

    /**
     * Returns the open session, opening it with {@code loader} if needed.
     *
     * @param chatId the chat identifier
     * @param loader creates the session when none is open
     * @return the open session
     */
    GraphSession open(String chatId, Function<String, GraphSession> loader);

    /**
     * Retrieves all open sessions.
     *
     * @return collection of open sessions
     */
    Collection<GraphSession> findAll();

    /**
     * Open sessions not accessed since {@code cutoff}, least recently used first.
     *
     * @param cutoff last access time bound
     * @return idle sessions
     */
    List<GraphSession> findIdleSince(Instant cutoff);

    /**
     * Least recently used open session.
     *
     * @return the session, empty if none is open
     */
    Optional<GraphSession> findLeastRecentlyUsed();

    /**
     * Checks if a session is open.
     *
     * @param chatId the chat identifier
     * @return true if open
     */
    boolean exists(String chatId);

    /**
     * Removes a session from the registry and marks it closed.
     *
     * @param chatId the chat identifier
     * @return true if removed, false if not open
     */
    boolean remove(String chatId);

    /**
     * Gets the count of open sessions.
     *
     * @return number of sessions
     */
    int count();
}
