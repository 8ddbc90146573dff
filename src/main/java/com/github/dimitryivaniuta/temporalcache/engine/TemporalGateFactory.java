package com.github.dimitryivaniuta.temporalcache.engine;

import com.github.dimitryivaniuta.temporalcache.engine.persist.BlobStore;
import com.github.dimitryivaniuta.temporalcache.engine.persist.SnapshotCodec;
import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds a {@link TemporalGate} over an in-memory or a persistent store, depending on
 * whether the params carry a persist path. Shared by the filesystem router and the
 * method interceptor so both wire gates the same way.
 */
@Slf4j
public class TemporalGateFactory {

    private final CacheSwitch cacheSwitch;
    private final Clock clock;
    private final BlobStore blobStore;
    private final CacheEventListener listener;

    public TemporalGateFactory(CacheSwitch cacheSwitch, Clock clock, BlobStore blobStore, CacheEventListener listener) {
        this.cacheSwitch = Objects.requireNonNull(cacheSwitch, "cacheSwitch must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.listener = listener != null ? listener : CacheEventListener.NOOP;
    }

    /**
     * @param codec only called when {@code params} is persistent
     */
    public <K, V> TemporalGate<K, V> create(String name, CacheParams params, Supplier<SnapshotCodec<K, V>> codec) {
        Objects.requireNonNull(params, "params must not be null");
        if (params.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a cache for empty params: " + name);
        }

        MemoStore<K, V> store = params.isPersistent()
                ? new PersistentMemoStore<>(name, params.effectiveCapacity(), params.persistPath(), blobStore, codec.get(), listener)
                : new LruMemoStore<>(name, params.effectiveCapacity(), listener);

        log.debug("Created cache {} (capacity={}, window={}, persistent={})",
                name, params.effectiveCapacity(), params.window(), params.isPersistent());
        return new TemporalGate<>(store, params.window(), cacheSwitch, clock, listener);
    }

    public CacheSwitch cacheSwitch() {
        return cacheSwitch;
    }

    public Clock clock() {
        return clock;
    }
}
