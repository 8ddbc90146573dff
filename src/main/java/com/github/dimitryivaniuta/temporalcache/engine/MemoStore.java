package com.github.dimitryivaniuta.temporalcache.engine;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Bounded memoization store.
 *
 * <p>The computation is passed per call: the owner (router, interceptor, function wrapper)
 * binds one loader per store, while method interception needs the continuation of the
 * current invocation.
 */
public interface MemoStore<K, V> {

    String name();

    /**
     * Serves {@code key} from the store or loads, stores and returns it.
     * Loader failures propagate unchanged and nothing is stored.
     */
    V call(K key, MemoLoader<? super K, ? extends V> loader) throws IOException;

    /** Runs the loader without reading or writing the store. */
    default V invokeDirect(K key, MemoLoader<? super K, ? extends V> loader) throws IOException {
        return loader.load(key);
    }

    void clear();

    int size();

    int capacity();

    /** Entries ordered from least to most recently used. */
    List<Map.Entry<K, V>> snapshot();
}
