package com.github.dimitryivaniuta.temporalcache.support;

import com.github.dimitryivaniuta.temporalcache.engine.CacheEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects cache events as "event:cacheName" strings. */
public final class RecordingListener implements CacheEventListener {

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final List<Exception> failures = new CopyOnWriteArrayList<>();

    @Override
    public void hit(String cacheName) {
        events.add("hit:" + cacheName);
    }

    @Override
    public void miss(String cacheName) {
        events.add("miss:" + cacheName);
    }

    @Override
    public void eviction(String cacheName) {
        events.add("eviction:" + cacheName);
    }

    @Override
    public void expiration(String cacheName) {
        events.add("expiration:" + cacheName);
    }

    @Override
    public void bypass(String cacheName) {
        events.add("bypass:" + cacheName);
    }

    @Override
    public void persistenceFailure(String cacheName, Exception cause) {
        events.add("persistenceFailure:" + cacheName);
        failures.add(cause);
    }

    public List<String> events() {
        return events;
    }

    public List<Exception> failures() {
        return failures;
    }

    public long count(String event) {
        return events.stream().filter(e -> e.startsWith(event + ":")).count();
    }
}
