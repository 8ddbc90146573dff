package com.github.dimitryivaniuta.temporalcache.engine.persist;

/**
 * A durable snapshot could not be read, decoded, written or deleted.
 * Never escapes a memo store: it is logged and reported as a persistence warning.
 */
public class SnapshotPersistenceException extends RuntimeException {

    public SnapshotPersistenceException(String message) {
        super(message);
    }

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
