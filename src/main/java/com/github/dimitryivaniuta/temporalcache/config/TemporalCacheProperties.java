package com.github.dimitryivaniuta.temporalcache.config;

import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;
import com.github.dimitryivaniuta.temporalcache.policy.DurationSpec;
import com.github.dimitryivaniuta.temporalcache.policy.PolicyResolver;
import com.github.dimitryivaniuta.temporalcache.policy.PolicyRules;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <pre>
 * temporal-cache:
 *   backend: local
 *   root: /srv/data
 *   policy:
 *     paths:
 *       "[/config.json]": { hours: 24 }
 *     globs:
 *       "[*.parquet]": { hours: 1, capacity: 512 }
 *     regex:
 *       "[\\.tmp$]": { seconds: 30 }
 *     default: { hours: 1 }
 * </pre>
 * Map keys need the bracket notation so Spring keeps {@code /}, {@code *} and {@code .} in them.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "temporal-cache")
public class TemporalCacheProperties {

    public enum Backend { LOCAL, MEMORY }

    /** Initial state of the global switch. */
    private boolean enabled = true;

    private Backend backend = Backend.LOCAL;

    /** Root directory of the local backend. */
    private String root = ".";

    private long resolutionCacheSize = PolicyResolver.DEFAULT_RESOLUTION_CACHE_SIZE;

    private Policy policy = new Policy();

    // never proxied for @TemporalCached
    private List<String> excludePackages = List.of(
            "org.springframework",
            "jakarta",
            "java",
            "com.fasterxml",
            "io.micrometer"
    );

    @Getter
    @Setter
    public static class Policy {
        private Map<String, Params> paths = new LinkedHashMap<>();
        private Map<String, Params> globs = new LinkedHashMap<>();
        private Map<String, Params> regex = new LinkedHashMap<>();
        private Params defaultParams;

        // "default" is a keyword, so the accessors are written out
        public Params getDefault() {
            return defaultParams;
        }

        public void setDefault(Params defaultParams) {
            this.defaultParams = defaultParams;
        }

        public PolicyRules toRules() {
            return new PolicyRules(convert(paths), convert(globs), convert(regex),
                    defaultParams != null ? defaultParams.toCacheParams() : CacheParams.NONE);
        }

        private static Map<String, CacheParams> convert(Map<String, Params> in) {
            Map<String, CacheParams> out = new LinkedHashMap<>();
            if (in != null) {
                in.forEach((k, v) -> out.put(k, v != null ? v.toCacheParams() : CacheParams.NONE));
            }
            return out;
        }
    }

    @Getter
    @Setter
    public static class Params {
        private Long seconds;
        private Long minutes;
        private Long hours;
        private Long days;
        private Long weeks;
        private Long months;
        private Long years;
        private Integer capacity;
        private String persistPath;

        public CacheParams toCacheParams() {
            DurationSpec duration = hasDuration()
                    ? new DurationSpec(orZero(seconds), orZero(minutes), orZero(hours), orZero(days),
                    orZero(weeks), orZero(months), orZero(years))
                    : null;
            return new CacheParams(duration, capacity, persistPath);
        }

        private boolean hasDuration() {
            return seconds != null || minutes != null || hours != null || days != null
                    || weeks != null || months != null || years != null;
        }

        private static long orZero(Long v) {
            return v != null ? v : 0L;
        }
    }
}
