package com.github.dimitryivaniuta.temporalcache.fs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.dimitryivaniuta.temporalcache.engine.CacheKey;

import java.io.IOException;

/**
 * A named, cacheable backend operation.
 *
 * @param name      cache identity; operations never share a cache instance
 * @param valueType result type, used to decode persisted snapshots
 * @param invoker   the uncached call
 */
public record FsOperation<R>(String name, TypeReference<R> valueType, Invoker<R> invoker) {

    @FunctionalInterface
    public interface Invoker<R> {
        R invoke(FileSystemBackend backend, CacheKey key) throws IOException;
    }

    public R invoke(FileSystemBackend backend, CacheKey key) throws IOException {
        return invoker.invoke(backend, key);
    }
}
