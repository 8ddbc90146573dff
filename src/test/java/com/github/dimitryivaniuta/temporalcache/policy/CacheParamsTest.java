package com.github.dimitryivaniuta.temporalcache.policy;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheParamsTest {

    @Test
    void shouldTreatNoComponentsAsDoNotCache() {
        assertThat(CacheParams.NONE.isEmpty()).isTrue();
        assertThat(new CacheParams(null, null, "  ").isEmpty()).isTrue();
        assertThat(CacheParams.NONE.identity()).isEqualTo("none");
    }

    @Test
    void shouldUseDefaultsForMissingComponents() {
        CacheParams capacityOnly = new CacheParams(null, 3, null);

        assertThat(capacityOnly.isEmpty()).isFalse();
        assertThat(capacityOnly.window()).isEqualTo(Duration.ZERO);
        assertThat(CacheParams.ofSeconds(10).effectiveCapacity()).isEqualTo(CacheParams.DEFAULT_CAPACITY);
    }

    @Test
    void shouldBuildStableIdentity() {
        CacheParams params = CacheParams.of(DurationSpec.builder().seconds(10).hours(1).build())
                .withCapacity(2)
                .withPersistPath("/tmp/c.json");

        assertThat(params.identity()).isEqualTo("capacity=2,hours=1,persist=/tmp/c.json,seconds=10");
        assertThat(CacheParams.of(DurationSpec.ZERO).identity()).isEqualTo("window=0");
    }

    @Test
    void shouldCompareByValue() {
        assertThat(CacheParams.ofSeconds(10).withCapacity(2))
                .isEqualTo(new CacheParams(DurationSpec.ofSeconds(10), 2, null));
        assertThat(CacheParams.ofSeconds(10)).isNotEqualTo(CacheParams.ofSeconds(10).withCapacity(128));
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> CacheParams.ofSeconds(1).withCapacity(0))
                .isInstanceOf(CacheConfigurationException.class);
    }
}
