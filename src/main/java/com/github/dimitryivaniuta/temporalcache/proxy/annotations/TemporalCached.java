package com.github.dimitryivaniuta.temporalcache.proxy.annotations;

import java.lang.annotation.*;

/**
 * Memoizes a bean method through a temporal cache.
 *
 * - Intended for idempotent read methods: concurrent misses may call the method twice.
 * - Key is the method signature plus the call arguments.
 * - The window is the sum of the duration components (month = 30 days, year = 365 days);
 *   all zero means the cache never expires on its own.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface TemporalCached {

    long seconds() default 0;

    long minutes() default 0;

    long hours() default 0;

    long days() default 0;

    long weeks() default 0;

    long months() default 0;

    long years() default 0;

    /**
     * Max entries, least recently used evicted first.
     */
    int capacity() default 128;

    /**
     * Snapshot file for the cache contents; empty keeps the cache in memory only.
     * The return type must be readable by Jackson, and every parameter a string, boolean,
     * number, or a list or array of them; other parameter types fail at startup.
     */
    String persistPath() default "";

    /**
     * Allows disabling caching on a method even if enabled on class.
     */
    boolean enabled() default true;
}
