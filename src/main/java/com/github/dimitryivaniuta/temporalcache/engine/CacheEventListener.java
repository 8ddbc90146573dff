package com.github.dimitryivaniuta.temporalcache.engine;

/**
 * Side channel for cache events. All callbacks are optional.
 */
public interface CacheEventListener {

    CacheEventListener NOOP = new CacheEventListener() {
    };

    default void hit(String cacheName) {
    }

    default void miss(String cacheName) {
    }

    default void eviction(String cacheName) {
    }

    /** The time window elapsed and the whole store was cleared. */
    default void expiration(String cacheName) {
    }

    /** Caching is globally disabled; the call went straight to the loader. */
    default void bypass(String cacheName) {
    }

    /** Durable snapshot could not be read, written or deleted. The in-memory view is unaffected. */
    default void persistenceFailure(String cacheName, Exception cause) {
    }
}
