package com.github.dimitryivaniuta.temporalcache.config;

import com.github.dimitryivaniuta.temporalcache.policy.CacheConfigurationException;
import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;
import com.github.dimitryivaniuta.temporalcache.policy.DurationSpec;
import com.github.dimitryivaniuta.temporalcache.policy.PolicyRules;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemporalCachePropertiesTest {

    private static TemporalCacheProperties.Params params(Long seconds, Long hours, Integer capacity) {
        TemporalCacheProperties.Params p = new TemporalCacheProperties.Params();
        p.setSeconds(seconds);
        p.setHours(hours);
        p.setCapacity(capacity);
        return p;
    }

    @Test
    void shouldConvertSectionsKeepingDeclaredOrder() {
        TemporalCacheProperties.Policy policy = new TemporalCacheProperties.Policy();
        policy.getGlobs().put("/data/*", params(null, 1L, null));
        policy.getGlobs().put("*.csv", params(30L, null, 2));
        policy.setDefault(params(5L, null, null));

        PolicyRules rules = policy.toRules();

        assertThat(rules.globs().keySet()).containsExactly("/data/*", "*.csv");
        assertThat(rules.globs().get("*.csv")).isEqualTo(CacheParams.ofSeconds(30).withCapacity(2));
        assertThat(rules.defaults()).isEqualTo(CacheParams.ofSeconds(5));
    }

    @Test
    void shouldTreatCapacityOnlyAsNeverExpiring() {
        CacheParams converted = params(null, null, 10).toCacheParams();

        assertThat(converted.duration()).isNull();
        assertThat(converted.window()).isZero();
        assertThat(converted.isEmpty()).isFalse();
    }

    @Test
    void shouldDefaultToNoCaching() {
        PolicyRules rules = new TemporalCacheProperties.Policy().toRules();

        assertThat(rules.defaults()).isEqualTo(CacheParams.NONE);
        assertThat(new TemporalCacheProperties.Params().toCacheParams().isEmpty()).isTrue();
    }

    @Test
    void shouldFailOnNegativeComponent() {
        assertThatThrownBy(() -> params(-1L, null, null).toCacheParams())
                .isInstanceOf(CacheConfigurationException.class);
        assertThat(params(0L, 2L, null).toCacheParams().duration())
                .isEqualTo(DurationSpec.builder().hours(2).build());
    }
}
