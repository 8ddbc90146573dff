package com.github.dimitryivaniuta.temporalcache.engine;

import java.io.IOException;

/**
 * The underlying computation a memo store wraps.
 * Must be idempotent: concurrent misses on the same key may invoke it more than once.
 */
@FunctionalInterface
public interface MemoLoader<K, V> {

    V load(K key) throws IOException;
}
