package com.weave.graph.service.persistence;

/**
 * Storage I/O failure in a persistence backend.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
