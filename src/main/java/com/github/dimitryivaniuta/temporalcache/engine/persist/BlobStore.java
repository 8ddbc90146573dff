package com.github.dimitryivaniuta.temporalcache.engine.persist;

import java.util.Optional;

/**
 * Byte-addressable durable target identified by a path-like location.
 * Implementations report failures as {@link SnapshotPersistenceException}.
 */
public interface BlobStore {

    /** @return the blob, or empty when nothing is stored at {@code location} */
    Optional<byte[]> read(String location);

    /** Replaces whatever is stored at {@code location}. */
    void write(String location, byte[] blob);

    void delete(String location);
}
