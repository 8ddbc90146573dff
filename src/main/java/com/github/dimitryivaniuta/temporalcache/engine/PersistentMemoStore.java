package com.github.dimitryivaniuta.temporalcache.engine;

import com.github.dimitryivaniuta.temporalcache.engine.persist.BlobStore;
import com.github.dimitryivaniuta.temporalcache.engine.persist.SnapshotCodec;
import com.github.dimitryivaniuta.temporalcache.engine.persist.SnapshotPersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * LRU memo store mirrored to a durable blob.
 *
 * <ul>
 *   <li>hydrated once, at construction; an absent or unreadable blob means an empty start</li>
 *   <li>every successful insert and every hit rewrites the full snapshot (O(size) per call),
 *       so the recency order on disk matches the one in memory</li>
 *   <li>{@link #clear()} deletes the blob as well</li>
 * </ul>
 *
 * Durability is best effort: blob failures are logged and reported to the listener,
 * the in-memory store keeps working.
 */
@Slf4j
public class PersistentMemoStore<K, V> extends LruMemoStore<K, V> {

    private final String persistPath;
    private final BlobStore blobStore;
    private final SnapshotCodec<K, V> codec;

    // snapshot + write happen under this lock so the newest snapshot is written last
    private final Object writeLock = new Object();

    public PersistentMemoStore(String name,
                               int capacity,
                               String persistPath,
                               BlobStore blobStore,
                               SnapshotCodec<K, V> codec,
                               CacheEventListener listener) {
        super(name, capacity, listener);
        this.persistPath = Objects.requireNonNull(persistPath, "persistPath must not be null");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        hydrate();
    }

    public String persistPath() {
        return persistPath;
    }

    @Override
    public void clear() {
        synchronized (writeLock) {
            super.clear();
            try {
                blobStore.delete(persistPath);
            } catch (SnapshotPersistenceException ex) {
                warn("delete", ex);
            }
        }
    }

    @Override
    protected void afterInsert() {
        writeSnapshot();
    }

    @Override
    protected void afterAccess() {
        writeSnapshot();
    }

    private void writeSnapshot() {
        synchronized (writeLock) {
            List<Map.Entry<K, V>> entries = snapshot();
            try {
                blobStore.write(persistPath, codec.encode(entries));
            } catch (SnapshotPersistenceException ex) {
                warn("write", ex);
            }
        }
    }

    private void hydrate() {
        try {
            Optional<byte[]> blob = blobStore.read(persistPath);
            if (blob.isEmpty()) {
                return;
            }
            List<Map.Entry<K, V>> entries = codec.decode(blob.get());
            preload(entries);
            log.debug("Cache {} hydrated {} entries from {}", name(), size(), persistPath);
        } catch (SnapshotPersistenceException ex) {
            warn("read", ex);
        }
    }

    private void warn(String action, SnapshotPersistenceException ex) {
        log.warn("Cache {} could not {} snapshot {}: {}", name(), action, persistPath, ex.getMessage(), ex);
        listener.persistenceFailure(name(), ex);
    }
}
