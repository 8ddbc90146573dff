package com.github.dimitryivaniuta.temporalcache.engine;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Wall-clock window over a memo store.
 *
 * <p>Per call:
 * <ol>
 *   <li>switch disabled: clear the store and call the loader directly</li>
 *   <li>window positive and {@code now - lastInvalidation > window}: clear the store, restart the window</li>
 *   <li>delegate to the store</li>
 * </ol>
 * Checked lazily on the calling thread, no timer. A zero window never expires.
 */
@Slf4j
public class TemporalGate<K, V> {

    private final MemoStore<K, V> store;
    private final Duration window;
    private final CacheSwitch cacheSwitch;
    private final Clock clock;
    private final CacheEventListener listener;

    // guarded by this
    private Instant lastInvalidation;

    public TemporalGate(MemoStore<K, V> store,
                        Duration window,
                        CacheSwitch cacheSwitch,
                        Clock clock,
                        CacheEventListener listener) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.window = window != null ? window : Duration.ZERO;
        if (this.window.isNegative()) throw new IllegalArgumentException("window must not be negative");
        this.cacheSwitch = Objects.requireNonNull(cacheSwitch, "cacheSwitch must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = listener != null ? listener : CacheEventListener.NOOP;
        this.lastInvalidation = clock.instant();
    }

    public V call(K key, MemoLoader<? super K, ? extends V> loader) throws IOException {
        if (cacheSwitch.isDisabled()) {
            store.clear();
            listener.bypass(store.name());
            return store.invokeDirect(key, loader);
        }
        expireIfDue();
        return store.call(key, loader);
    }

    /** Manual clear; also restarts the window. */
    public synchronized void invalidate() {
        store.clear();
        lastInvalidation = clock.instant();
    }

    public synchronized Instant lastInvalidation() {
        return lastInvalidation;
    }

    public String name() {
        return store.name();
    }

    public Duration window() {
        return window;
    }

    public int size() {
        return store.size();
    }

    public MemoStore<K, V> store() {
        return store;
    }

    private synchronized void expireIfDue() {
        if (window.isZero()) return;

        Instant now = clock.instant();
        // strict: an entry is still served exactly at the boundary
        if (Duration.between(lastInvalidation, now).compareTo(window) > 0) {
            store.clear();
            lastInvalidation = now;
            listener.expiration(store.name());
            log.debug("Cache {} expired after {}", store.name(), window);
        }
    }
}
