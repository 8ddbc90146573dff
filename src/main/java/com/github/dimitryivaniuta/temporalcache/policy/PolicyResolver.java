package com.github.dimitryivaniuta.temporalcache.policy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Picks the {@link CacheParams} for a key. First match wins:
 * <ol>
 *   <li>exact key</li>
 *   <li>first glob, in declared order, matching the whole key</li>
 *   <li>first regex, in declared order, found anywhere in the key</li>
 *   <li>the default (possibly {@link CacheParams#NONE})</li>
 * </ol>
 *
 * <p>Patterns are compiled here, so a malformed regex fails construction. Resolutions are
 * memoized in a bounded Caffeine cache: rules are immutable, so an entry never goes stale.
 */
@Slf4j
public class PolicyResolver {

    public static final long DEFAULT_RESOLUTION_CACHE_SIZE = 10_000;

    private final PolicyRules rules;
    private final List<Rule<GlobPattern>> globs;
    private final List<Rule<Pattern>> regexes;
    private final Cache<String, CacheParams> resolutions;

    public PolicyResolver(PolicyRules rules) {
        this(rules, DEFAULT_RESOLUTION_CACHE_SIZE);
    }

    public PolicyResolver(PolicyRules rules, long resolutionCacheSize) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        if (resolutionCacheSize <= 0) {
            throw new CacheConfigurationException("resolutionCacheSize must be > 0, got " + resolutionCacheSize);
        }

        List<Rule<GlobPattern>> g = new ArrayList<>();
        for (Map.Entry<String, CacheParams> e : rules.globs().entrySet()) {
            g.add(new Rule<>(GlobPattern.compile(e.getKey()), e.getValue()));
        }
        this.globs = List.copyOf(g);

        List<Rule<Pattern>> r = new ArrayList<>();
        for (Map.Entry<String, CacheParams> e : rules.regexes().entrySet()) {
            r.add(new Rule<>(compileRegex(e.getKey()), e.getValue()));
        }
        this.regexes = List.copyOf(r);

        this.resolutions = Caffeine.newBuilder()
                .maximumSize(resolutionCacheSize)
                .build();

        log.debug("Policy resolver built: {} paths, {} globs, {} regexes, default={}",
                rules.paths().size(), globs.size(), regexes.size(), rules.defaults().identity());
    }

    public CacheParams resolve(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return resolutions.get(key, this::match);
    }

    public PolicyRules rules() {
        return rules;
    }

    private CacheParams match(String key) {
        CacheParams exact = rules.paths().get(key);
        if (exact != null) {
            return exact;
        }
        for (Rule<GlobPattern> rule : globs) {
            if (rule.pattern().matches(key)) {
                return rule.params();
            }
        }
        for (Rule<Pattern> rule : regexes) {
            if (rule.pattern().matcher(key).find()) {
                return rule.params();
            }
        }
        return rules.defaults();
    }

    private static Pattern compileRegex(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException ex) {
            throw new CacheConfigurationException("Malformed regex rule '" + regex + "': " + ex.getDescription(), ex);
        }
    }

    private record Rule<P>(P pattern, CacheParams params) {}
}
