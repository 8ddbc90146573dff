package com.github.dimitryivaniuta.temporalcache.policy;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyResolverTest {

    private static final CacheParams DAY = CacheParams.of(DurationSpec.builder().hours(24).build());
    private static final CacheParams HOUR = CacheParams.of(DurationSpec.builder().hours(1).build());
    private static final CacheParams SHORT = CacheParams.ofSeconds(30);
    private static final CacheParams FALLBACK = CacheParams.of(DurationSpec.builder().minutes(10).build());

    private final PolicyResolver resolver = new PolicyResolver(PolicyRules.builder()
            .path("/config.json", DAY)
            .glob("*.parquet", HOUR)
            .glob("*.json", CacheParams.ofSeconds(5))
            .regex("\\.tmp$", SHORT)
            .defaults(FALLBACK)
            .build());

    @Test
    void shouldPreferExactOverGlob() {
        assertThat(resolver.resolve("/config.json")).isEqualTo(DAY);
        assertThat(resolver.resolve("/other.json")).isEqualTo(CacheParams.ofSeconds(5));
    }

    @Test
    void shouldPreferGlobAndExactOverRegex() {
        PolicyResolver overlapping = new PolicyResolver(PolicyRules.builder()
                .path("/pinned.tmp", DAY)
                .glob("*.tmp", HOUR)
                .regex("\\.tmp$", SHORT)
                .regex("^/logs/", CacheParams.ofSeconds(5))
                .path("/logs/app.out", FALLBACK)
                .build());

        assertThat(overlapping.resolve("/x.tmp")).isEqualTo(HOUR);
        assertThat(overlapping.resolve("/pinned.tmp")).isEqualTo(DAY);
        assertThat(overlapping.resolve("/logs/app.out")).isEqualTo(FALLBACK);
        assertThat(overlapping.resolve("/logs/other.out")).isEqualTo(CacheParams.ofSeconds(5));
    }

    @Test
    void shouldMatchGlobsAgainstWholeKey() {
        assertThat(resolver.resolve("/data/x.parquet")).isEqualTo(HOUR);
        assertThat(resolver.resolve("/data/x.parquet.old")).isEqualTo(FALLBACK);
    }

    @Test
    void shouldSearchRegexAnywhereInKey() {
        assertThat(resolver.resolve("/scratch/a.tmp")).isEqualTo(SHORT);
        assertThat(resolver.resolve("/scratch/a.tmp.txt")).isEqualTo(FALLBACK);
    }

    @Test
    void shouldPickFirstGlobInDeclaredOrder() {
        PolicyResolver ordered = new PolicyResolver(PolicyRules.builder()
                .glob("/data/*", HOUR)
                .glob("*.csv", SHORT)
                .build());

        assertThat(ordered.resolve("/data/a.csv")).isEqualTo(HOUR);
        assertThat(ordered.resolve("/other/a.csv")).isEqualTo(SHORT);
    }

    @Test
    void shouldFallBackToEmptyParamsWithoutDefault() {
        PolicyResolver noDefault = new PolicyResolver(PolicyRules.builder().path("/a", DAY).build());

        assertThat(noDefault.resolve("/b")).isSameAs(CacheParams.NONE);
        assertThat(noDefault.resolve("/b").isEmpty()).isTrue();
    }

    @Test
    void shouldReturnMemoizedResolution() {
        CacheParams first = resolver.resolve("/data/x.parquet");

        assertThat(resolver.resolve("/data/x.parquet")).isSameAs(first);
    }

    @Test
    void shouldFailOnMalformedRegex() {
        assertThatThrownBy(() -> new PolicyResolver(PolicyRules.builder().regex("([a-z", HOUR).build()))
                .isInstanceOf(CacheConfigurationException.class)
                .hasMessageContaining("([a-z");
    }

    @Test
    void shouldFailOnNonPositiveResolutionCacheSize() {
        assertThatThrownBy(() -> new PolicyResolver(PolicyRules.EMPTY, 0))
                .isInstanceOf(CacheConfigurationException.class);
    }
}
