package com.github.dimitryivaniuta.temporalcache.engine;

import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;
import com.github.dimitryivaniuta.temporalcache.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemporalCachesTest {

    private final MutableClock clock = new MutableClock();
    private final CacheSwitch cacheSwitch = new CacheSwitch();

    @Test
    void shouldMemoizeFunctionForTheWindow() {
        AtomicInteger calls = new AtomicInteger();
        Function<String, Integer> length = TemporalCaches.interval(CacheParams.ofSeconds(5),
                s -> {
                    calls.incrementAndGet();
                    return s.length();
                }, cacheSwitch, clock);

        assertThat(length.apply("abc")).isEqualTo(3);
        assertThat(length.apply("abc")).isEqualTo(3);
        assertThat(calls).hasValue(1);

        clock.advanceSeconds(6);
        assertThat(length.apply("abc")).isEqualTo(3);
        assertThat(calls).hasValue(2);
    }

    @Test
    void shouldHonourCapacity() {
        AtomicInteger calls = new AtomicInteger();
        Function<Integer, Integer> square = TemporalCaches.interval(CacheParams.ofSeconds(60).withCapacity(1),
                i -> {
                    calls.incrementAndGet();
                    return i * i;
                }, cacheSwitch, clock);

        square.apply(2);
        square.apply(3);
        square.apply(2);

        assertThat(calls).hasValue(3);
    }

    @Test
    void shouldPropagateFunctionFailures() {
        Function<String, String> failing = TemporalCaches.interval(CacheParams.ofSeconds(60),
                s -> {
                    throw new IllegalStateException("boom " + s);
                }, cacheSwitch, clock);

        assertThatThrownBy(() -> failing.apply("x"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom x");
    }

    @Test
    void shouldRejectPersistentParams() {
        CacheParams persistent = CacheParams.ofSeconds(60).withPersistPath("/tmp/x.json");

        assertThatThrownBy(() -> TemporalCaches.interval(persistent, Function.identity(), cacheSwitch, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
