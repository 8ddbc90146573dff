package com.github.dimitryivaniuta.temporalcache.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Argument tuple of a memoized call: the leading key (a path, or a method signature)
 * plus the remaining arguments in call order.
 *
 * <p>Integral numbers are normalized to {@code Long} and {@code Object[]} to lists so that
 * keys compare equal after a JSON snapshot round trip.
 */
public record CacheKey(String path, List<Object> args) {

    public CacheKey {
        Objects.requireNonNull(path, "path must not be null");
        args = (args == null || args.isEmpty()) ? List.of() : normalize(args);
    }

    public static CacheKey of(String path, Object... args) {
        return new CacheKey(path, args == null ? null : Arrays.asList(args));
    }

    public Object arg(int index) {
        return index < args.size() ? args.get(index) : null;
    }

    private static List<Object> normalize(List<?> raw) {
        List<Object> out = new ArrayList<>(raw.size());
        for (Object a : raw) {
            out.add(normalizeValue(a));
        }
        return Collections.unmodifiableList(out);
    }

    private static Object normalizeValue(Object a) {
        if (a instanceof Integer || a instanceof Short || a instanceof Byte) {
            return ((Number) a).longValue();
        }
        if (a instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        if (a instanceof Float f) {
            return f.doubleValue();
        }
        if (a instanceof Object[] arr) {
            return normalize(Arrays.asList(arr));
        }
        if (a instanceof List<?> list) {
            return normalize(list);
        }
        return a;
    }
}
