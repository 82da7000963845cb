package com.weave.graph.service.persistence;

import lombok.Getter;

/**
 * Thrown when a persisted record cannot be turned back into a complete graph snapshot.
 */
@Getter
public class MalformedSnapshotException extends RuntimeException {

    private final String key;

    public MalformedSnapshotException(String key, String message) {
        super("Malformed snapshot '" + key + "': " + message);
        this.key = key;
    }

    public MalformedSnapshotException(String key, String message, Throwable cause) {
        super("Malformed snapshot '" + key + "': " + message, cause);
        this.key = key;
    }
}
