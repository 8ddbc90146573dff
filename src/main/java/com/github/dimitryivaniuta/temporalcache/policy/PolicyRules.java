package com.github.dimitryivaniuta.temporalcache.policy;

import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative cache policy: exact keys, globs, regexes (each in declared order) and a default.
 * Immutable once built.
 */
@Builder
public record PolicyRules(@Singular("path") Map<String, CacheParams> paths,
                          @Singular("glob") Map<String, CacheParams> globs,
                          @Singular("regex") Map<String, CacheParams> regexes,
                          CacheParams defaults) {

    public static final PolicyRules EMPTY = new PolicyRules(null, null, null, null);

    public PolicyRules {
        paths = ordered(paths);
        globs = ordered(globs);
        regexes = ordered(regexes);
        defaults = defaults != null ? defaults : CacheParams.NONE;
    }

    private static Map<String, CacheParams> ordered(Map<String, CacheParams> in) {
        if (in == null || in.isEmpty()) return Map.of();
        Map<String, CacheParams> copy = new LinkedHashMap<>();
        in.forEach((k, v) -> copy.put(k, v != null ? v : CacheParams.NONE));
        return Collections.unmodifiableMap(copy);
    }
}
