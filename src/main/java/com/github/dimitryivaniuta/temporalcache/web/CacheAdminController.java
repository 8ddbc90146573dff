package com.github.dimitryivaniuta.temporalcache.web;

import com.github.dimitryivaniuta.temporalcache.engine.CacheSwitch;
import com.github.dimitryivaniuta.temporalcache.engine.PersistentMemoStore;
import com.github.dimitryivaniuta.temporalcache.engine.TemporalGate;
import com.github.dimitryivaniuta.temporalcache.fs.CachedFileSystem;
import com.github.dimitryivaniuta.temporalcache.proxy.MethodCacheInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/cache")
public class CacheAdminController {

    private final CachedFileSystem fileSystem;
    private final MethodCacheInterceptor methodCache;
    private final CacheSwitch cacheSwitch;

    // ---------- DTOs ----------
    public record CacheStatusResponse(
            boolean enabled,
            String fileSystem,
            List<GateResponse> gates
    ) {}

    public record GateResponse(
            String name,
            String kind,          // "fs" or "method"
            int size,
            int capacity,
            long windowSeconds,   // 0 = never expires
            boolean persistent,
            Instant lastInvalidation
    ) {}

    // ---------- endpoints ----------

    @GetMapping
    public CacheStatusResponse status() {
        List<GateResponse> gates = new ArrayList<>();
        fileSystem.router().gates().values().forEach(g -> gates.add(toResponse(g, "fs")));
        methodCache.gates().values().forEach(g -> gates.add(toResponse(g, "method")));
        gates.sort(Comparator.comparing(GateResponse::kind).thenComparing(GateResponse::name));
        return new CacheStatusResponse(cacheSwitch.isEnabled(), fileSystem.toString(), gates);
    }

    /** Without {@code path} every filesystem and method cache is cleared. */
    @DeleteMapping
    public CacheStatusResponse invalidate(@RequestParam(required = false) String path) {
        if (path == null || path.isBlank()) {
            fileSystem.clearCache();
            methodCache.invalidate();
            log.info("Invalidated all temporal caches");
        } else {
            fileSystem.clearCache(path);
            log.info("Invalidated temporal caches for {}", path);
        }
        return status();
    }

    @PostMapping("/disable")
    public CacheStatusResponse disable() {
        cacheSwitch.disable();
        log.info("Temporal caching disabled");
        return status();
    }

    @PostMapping("/enable")
    public CacheStatusResponse enable() {
        cacheSwitch.enable();
        log.info("Temporal caching enabled");
        return status();
    }

    private static GateResponse toResponse(TemporalGate<?, ?> gate, String kind) {
        return new GateResponse(
                gate.name(),
                kind,
                gate.size(),
                gate.store().capacity(),
                gate.window().getSeconds(),
                gate.store() instanceof PersistentMemoStore,
                gate.lastInvalidation()
        );
    }
}
