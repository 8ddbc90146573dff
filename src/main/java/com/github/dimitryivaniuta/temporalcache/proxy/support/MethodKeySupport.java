package com.github.dimitryivaniuta.temporalcache.proxy.support;

import java.lang.reflect.Method;

public final class MethodKeySupport {
    private MethodKeySupport() {}

    // Used as the cache key prefix and as the cache name
    public static String signature(Class<?> targetClass, Method method) {
        Class<?>[] p = method.getParameterTypes();
        StringBuilder sb = new StringBuilder(targetClass.getName())
                .append("#")
                .append(method.getName())
                .append("(");
        for (int i = 0; i < p.length; i++) {
            if (i > 0) sb.append(",");
            sb.append(p[i].getSimpleName());
        }
        return sb.append(")").toString();
    }
}
