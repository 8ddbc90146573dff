package com.github.dimitryivaniuta.temporalcache.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyTest {

    @Test
    void shouldTreatIntegralWidthsAsEqual() {
        assertThat(CacheKey.of("/f", 1, (short) 2)).isEqualTo(CacheKey.of("/f", 1L, 2L));
    }

    @Test
    void shouldTreatArraysAndListsAsEqual() {
        assertThat(CacheKey.of("/f", (Object) new Object[]{"a", 1}))
                .isEqualTo(CacheKey.of("/f", List.of("a", 1L)));
    }

    @Test
    void shouldDistinguishArgumentOrderAndNulls() {
        assertThat(CacheKey.of("/f", 1L, 2L)).isNotEqualTo(CacheKey.of("/f", 2L, 1L));
        assertThat(CacheKey.of("/f", null, 5L)).isNotEqualTo(CacheKey.of("/f", 5L, null));
        assertThat(CacheKey.of("/f").args()).isEmpty();
    }

    @Test
    void shouldReturnNullForMissingArgument() {
        CacheKey key = CacheKey.of("/f", 10L);

        assertThat(key.arg(0)).isEqualTo(10L);
        assertThat(key.arg(1)).isNull();
    }
}
