package com.github.dimitryivaniuta.temporalcache.engine;

import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/**
 * Time-windowed memoization of plain functions.
 *
 * <pre>{@code
 * Function<String, Rates> rates = TemporalCaches.interval(
 *         CacheParams.of(DurationSpec.builder().minutes(5).build()), ratesClient::fetch);
 * }</pre>
 *
 * Uses the global {@link CacheSwitch} and the system clock unless given others.
 * Persistence needs a codec: build the gate through {@link TemporalGateFactory} for that.
 */
public final class TemporalCaches {

    private TemporalCaches() {
    }

    public static <K, V> Function<K, V> interval(CacheParams params, Function<K, V> fn) {
        return interval(params, fn, CacheSwitch.global(), Clock.systemUTC());
    }

    public static <K, V> Function<K, V> interval(CacheParams params, Function<K, V> fn, CacheSwitch cacheSwitch, Clock clock) {
        Objects.requireNonNull(fn, "fn must not be null");
        if (params.isPersistent()) {
            throw new IllegalArgumentException("persistent params need a snapshot codec, use TemporalGateFactory");
        }
        LruMemoStore<K, V> store = new LruMemoStore<>("interval:" + params.identity(), params.effectiveCapacity(), null);
        TemporalGate<K, V> gate = new TemporalGate<>(store, params.window(), cacheSwitch, clock, null);
        MemoLoader<K, V> loader = fn::apply;

        return key -> {
            try {
                return gate.call(key, loader);
            } catch (IOException ex) {
                // unreachable: fn declares no checked exceptions
                throw new UncheckedIOException(ex);
            }
        };
    }
}
