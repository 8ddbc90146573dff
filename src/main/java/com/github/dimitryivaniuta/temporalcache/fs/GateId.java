package com.github.dimitryivaniuta.temporalcache.fs;

import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;

/** Registry key: one cache instance per operation and resolved policy. */
public record GateId(String operation, CacheParams params) {

    /** e.g. {@code "catFile[capacity=2,seconds=10]"} */
    public String cacheName() {
        return operation + "[" + params.identity() + "]";
    }
}
