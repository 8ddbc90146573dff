package com.github.dimitryivaniuta.temporalcache.metrics;

import com.github.dimitryivaniuta.temporalcache.engine.CacheEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class TemporalCacheMetrics implements CacheEventListener {

    private final MeterRegistry registry;

    public TemporalCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Lookups ----
    @Override
    public void hit(String cacheName) {
        increment("temporal_cache_hits_total", cacheName);
    }

    @Override
    public void miss(String cacheName) {
        increment("temporal_cache_misses_total", cacheName);
    }

    // ---- Invalidation ----
    @Override
    public void eviction(String cacheName) {
        increment("temporal_cache_evictions_total", cacheName);
    }

    @Override
    public void expiration(String cacheName) {
        increment("temporal_cache_expirations_total", cacheName);
    }

    @Override
    public void bypass(String cacheName) {
        increment("temporal_cache_bypass_total", cacheName);
    }

    // ---- Persistence ----
    @Override
    public void persistenceFailure(String cacheName, Exception cause) {
        Counter.builder("temporal_cache_persistence_failures_total")
                .tag("cache", cacheName)
                .tag("exception", cause.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    private void increment(String metricName, String cacheName) {
        Counter.builder(metricName)
                .tag("cache", cacheName)
                .register(registry)
                .increment();
    }
}
