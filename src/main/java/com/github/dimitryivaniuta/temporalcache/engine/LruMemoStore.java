package com.github.dimitryivaniuta.temporalcache.engine;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory LRU memo store.
 *
 * <ul>
 *   <li>access-ordered LinkedHashMap: recency moves on hit and on write</li>
 *   <li>subclasses are told about both through {@link #afterAccess()} and {@link #afterInsert()}</li>
 *   <li>the loader runs outside the lock (no single-flight); last writer wins</li>
 *   <li>after each insert the least recently used entries are dropped down to capacity</li>
 * </ul>
 */
@Slf4j
public class LruMemoStore<K, V> implements MemoStore<K, V> {

    private final String name;
    private final int capacity;
    protected final CacheEventListener listener;

    // guarded by itself
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>(16, 0.75f, true);

    public LruMemoStore(String name, int capacity, CacheEventListener listener) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.capacity = capacity;
        this.listener = listener != null ? listener : CacheEventListener.NOOP;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public V call(K key, MemoLoader<? super K, ? extends V> loader) throws IOException {
        Objects.requireNonNull(key, "key must not be null");
        boolean hit = false;
        V cached = null;
        synchronized (entries) {
            if (entries.containsKey(key)) {
                hit = true;
                cached = entries.get(key);
            }
        }
        if (hit) {
            listener.hit(name);
            afterAccess();
            return cached;
        }

        listener.miss(name);
        V value = loader.load(key);
        insert(key, value);
        afterInsert();
        return value;
    }

    @Override
    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    @Override
    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public List<Map.Entry<K, V>> snapshot() {
        synchronized (entries) {
            List<Map.Entry<K, V>> out = new ArrayList<>(entries.size());
            for (Map.Entry<K, V> e : entries.entrySet()) {
                out.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue()));
            }
            return out;
        }
    }

    /** Hook for subclasses, runs on the calling thread after a successful insert. */
    protected void afterInsert() {
    }

    /** Hook for subclasses, runs on the calling thread after a hit has refreshed recency. */
    protected void afterAccess() {
    }

    /**
     * Loads entries ordered oldest first; when there are more than {@code capacity}
     * the oldest ones are dropped.
     */
    protected void preload(List<Map.Entry<K, V>> ordered) {
        synchronized (entries) {
            for (Map.Entry<K, V> e : ordered) {
                entries.put(e.getKey(), e.getValue());
            }
            int dropped = trimToCapacity();
            if (dropped > 0) {
                log.debug("Cache {} dropped {} oldest entries while preloading", name, dropped);
            }
        }
    }

    private void insert(K key, V value) {
        int evicted;
        synchronized (entries) {
            entries.put(key, value);
            evicted = trimToCapacity();
        }
        for (int i = 0; i < evicted; i++) {
            listener.eviction(name);
        }
    }

    private int trimToCapacity() {
        int removed = 0;
        Iterator<K> it = entries.keySet().iterator();
        while (entries.size() > capacity && it.hasNext()) {
            it.next();
            it.remove();
            removed++;
        }
        return removed;
    }
}
