package com.github.dimitryivaniuta.temporalcache.policy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolved cache parameters for a key.
 *
 * <p>Every component is optional. {@link #NONE} (nothing set) means "do not cache".
 * Equality is structural, so two rules with the same settings share one cache instance.
 */
public record CacheParams(DurationSpec duration, Integer capacity, String persistPath) {

    public static final int DEFAULT_CAPACITY = 128;

    public static final CacheParams NONE = new CacheParams(null, null, null);

    public CacheParams {
        if (capacity != null && capacity <= 0) {
            throw new CacheConfigurationException("capacity must be > 0, got " + capacity);
        }
        if (persistPath != null && persistPath.isBlank()) {
            persistPath = null;
        }
    }

    public static CacheParams of(DurationSpec duration) {
        return new CacheParams(duration, null, null);
    }

    public static CacheParams ofSeconds(long seconds) {
        return of(DurationSpec.ofSeconds(seconds));
    }

    public CacheParams withCapacity(int capacity) {
        return new CacheParams(duration, capacity, persistPath);
    }

    public CacheParams withPersistPath(String persistPath) {
        return new CacheParams(duration, capacity, persistPath);
    }

    public boolean isEmpty() {
        return duration == null && capacity == null && persistPath == null;
    }

    public boolean isPersistent() {
        return persistPath != null;
    }

    public int effectiveCapacity() {
        return capacity != null ? capacity : DEFAULT_CAPACITY;
    }

    /** Zero when no duration is set: the cache never expires on its own. */
    public Duration window() {
        return duration != null ? duration.toDuration() : Duration.ZERO;
    }

    /**
     * Stable, human readable identity, e.g. {@code "capacity=2,seconds=10"}.
     * Only explicitly set components take part, sorted by name.
     */
    public String identity() {
        List<String> parts = new ArrayList<>();
        if (capacity != null) parts.add("capacity=" + capacity);
        if (persistPath != null) parts.add("persist=" + persistPath);
        if (duration != null) {
            addIfSet(parts, "seconds", duration.seconds());
            addIfSet(parts, "minutes", duration.minutes());
            addIfSet(parts, "hours", duration.hours());
            addIfSet(parts, "days", duration.days());
            addIfSet(parts, "weeks", duration.weeks());
            addIfSet(parts, "months", duration.months());
            addIfSet(parts, "years", duration.years());
            if (duration.isZero()) parts.add("window=0");
        }
        Collections.sort(parts);
        return parts.isEmpty() ? "none" : String.join(",", parts);
    }

    private static void addIfSet(List<String> parts, String name, long value) {
        if (value != 0) parts.add(name + "=" + value);
    }
}
