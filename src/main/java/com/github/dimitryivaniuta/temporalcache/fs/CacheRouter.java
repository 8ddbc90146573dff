package com.github.dimitryivaniuta.temporalcache.fs;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.temporalcache.engine.CacheKey;
import com.github.dimitryivaniuta.temporalcache.engine.CacheSwitch;
import com.github.dimitryivaniuta.temporalcache.engine.MemoLoader;
import com.github.dimitryivaniuta.temporalcache.engine.TemporalGate;
import com.github.dimitryivaniuta.temporalcache.engine.TemporalGateFactory;
import com.github.dimitryivaniuta.temporalcache.engine.persist.JacksonSnapshotCodec;
import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;
import com.github.dimitryivaniuta.temporalcache.policy.PolicyResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes backend operations through temporal caches.
 *
 * <p>For every call the key's params are resolved; calls without params go straight to the
 * backend. Otherwise the gate registered for {@code (operation, params)} serves the call.
 * Gates are created lazily, once ({@code computeIfAbsent}), and live as long as the router.
 * Keys with equal params share one gate per operation.
 *
 * <p>Persistent gates write to {@code <persistPath>.<operation>} so operations sharing a
 * policy keep separate snapshots.
 */
@Slf4j
public class CacheRouter {

    private final FileSystemBackend backend;
    private final PolicyResolver resolver;
    private final TemporalGateFactory gateFactory;
    private final ObjectMapper snapshotMapper;

    private final Map<GateId, TemporalGate<CacheKey, ?>> gates = new ConcurrentHashMap<>();

    public CacheRouter(FileSystemBackend backend,
                       PolicyResolver resolver,
                       TemporalGateFactory gateFactory,
                       ObjectMapper snapshotMapper) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.gateFactory = Objects.requireNonNull(gateFactory, "gateFactory must not be null");
        this.snapshotMapper = Objects.requireNonNull(snapshotMapper, "snapshotMapper must not be null");
    }

    public <R> R dispatch(FsOperation<R> op, String path, Object... args) throws IOException {
        CacheKey key = CacheKey.of(path, args);
        CacheParams params = resolver.resolve(path);
        if (params.isEmpty()) {
            return op.invoke(backend, key);
        }

        GateId id = new GateId(op.name(), params);
        MemoLoader<CacheKey, R> loader = k -> op.invoke(backend, k);

        CacheSwitch cacheSwitch = gateFactory.cacheSwitch();
        if (cacheSwitch.isDisabled()) {
            // an existing gate clears itself and passes through; no gate is created while disabled
            TemporalGate<CacheKey, R> existing = lookup(id);
            return existing != null ? existing.call(key, loader) : loader.load(key);
        }
        return gateFor(id, op).call(key, loader);
    }

    /** Clears every gate whose params equal those of {@code path}, across all operations. */
    public void invalidate(String path) {
        CacheParams params = resolver.resolve(path);
        if (params.isEmpty()) {
            return;
        }
        gates.forEach((id, gate) -> {
            if (id.params().equals(params)) {
                gate.invalidate();
            }
        });
        log.debug("Invalidated caches for {} ({})", path, params.identity());
    }

    public void invalidate() {
        gates.values().forEach(TemporalGate::invalidate);
        log.debug("Invalidated all {} caches", gates.size());
    }

    public Map<GateId, TemporalGate<CacheKey, ?>> gates() {
        return Collections.unmodifiableMap(gates);
    }

    public PolicyResolver resolver() {
        return resolver;
    }

    @SuppressWarnings("unchecked")
    private <R> TemporalGate<CacheKey, R> lookup(GateId id) {
        return (TemporalGate<CacheKey, R>) gates.get(id);
    }

    @SuppressWarnings("unchecked")
    private <R> TemporalGate<CacheKey, R> gateFor(GateId id, FsOperation<R> op) {
        return (TemporalGate<CacheKey, R>) gates.computeIfAbsent(id, k -> createGate(k, op));
    }

    private <R> TemporalGate<CacheKey, R> createGate(GateId id, FsOperation<R> op) {
        CacheParams params = id.params();
        if (params.isPersistent()) {
            params = params.withPersistPath(params.persistPath() + "." + op.name());
        }
        JavaType valueType = snapshotMapper.getTypeFactory().constructType(op.valueType());
        return gateFactory.create(id.cacheName(), params,
                () -> JacksonSnapshotCodec.<R>forCacheKeys(snapshotMapper, valueType));
    }
}
