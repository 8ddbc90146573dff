package com.github.dimitryivaniuta.temporalcache.proxy;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.temporalcache.engine.CacheKey;
import com.github.dimitryivaniuta.temporalcache.engine.TemporalGate;
import com.github.dimitryivaniuta.temporalcache.engine.TemporalGateFactory;
import com.github.dimitryivaniuta.temporalcache.engine.persist.JacksonSnapshotCodec;
import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;
import com.github.dimitryivaniuta.temporalcache.policy.DurationSpec;
import com.github.dimitryivaniuta.temporalcache.proxy.annotations.TemporalCached;
import com.github.dimitryivaniuta.temporalcache.proxy.support.MethodKeySupport;
import lombok.RequiredArgsConstructor;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves {@link TemporalCached} methods from one temporal cache per method signature.
 * Exceptions thrown by the method reach the caller unchanged and are never cached.
 */
@RequiredArgsConstructor
public class MethodCacheInterceptor implements MethodInterceptor {

    private final TemporalGateFactory gateFactory;
    private final ObjectMapper snapshotMapper;

    private final Map<String, TemporalGate<CacheKey, Object>> gates = new ConcurrentHashMap<>();

    @Override
    public Object invoke(MethodInvocation inv) throws Throwable {
        if (inv.getMethod().getDeclaringClass() == Object.class) return inv.proceed();

        Class<?> targetClass = resolveTargetClass(inv);
        TemporalCached ann = find(targetClass, inv.getMethod());
        if (ann == null || !ann.enabled()) return inv.proceed();
        if (inv.getMethod().getReturnType() == void.class) return inv.proceed();

        String signature = MethodKeySupport.signature(targetClass, inv.getMethod());
        TemporalGate<CacheKey, Object> gate = gateFactory.cacheSwitch().isDisabled()
                ? gates.get(signature)
                : gates.computeIfAbsent(signature, s -> createGate(s, ann, inv.getMethod()));
        // no gate is created while caching is disabled
        if (gate == null) return inv.proceed();

        CacheKey key = CacheKey.of(signature, inv.getArguments());
        try {
            return gate.call(key, k -> proceed(inv));
        } catch (ProceedFailure ex) {
            throw ex.getCause();
        }
    }

    public Map<String, TemporalGate<CacheKey, Object>> gates() {
        return Collections.unmodifiableMap(gates);
    }

    public void invalidate() {
        gates.values().forEach(TemporalGate::invalidate);
    }

    static CacheParams toParams(TemporalCached ann) {
        DurationSpec duration = new DurationSpec(ann.seconds(), ann.minutes(), ann.hours(), ann.days(),
                ann.weeks(), ann.months(), ann.years());
        return new CacheParams(duration, ann.capacity(), ann.persistPath());
    }

    static TemporalCached find(Class<?> cls, Method m) {
        TemporalCached onMethod = AnnotatedElementUtils.findMergedAnnotation(m, TemporalCached.class);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(cls, TemporalCached.class);
    }

    private TemporalGate<CacheKey, Object> createGate(String signature, TemporalCached ann, Method method) {
        JavaType valueType = snapshotMapper.getTypeFactory().constructType(method.getGenericReturnType());
        return gateFactory.create(signature, toParams(ann),
                () -> JacksonSnapshotCodec.<Object>forCacheKeys(snapshotMapper, valueType));
    }

    private static Object proceed(MethodInvocation inv) throws IOException {
        try {
            return inv.proceed();
        } catch (IOException | RuntimeException | Error ex) {
            throw ex;
        } catch (Throwable ex) {
            throw new ProceedFailure(ex);
        }
    }

    private static Class<?> resolveTargetClass(MethodInvocation inv) {
        Object target = inv.getThis();
        return target != null ? AopUtils.getTargetClass(target) : inv.getMethod().getDeclaringClass();
    }

    /** Carries a checked, non-IO exception of the target method through the cache. */
    private static final class ProceedFailure extends RuntimeException {
        ProceedFailure(Throwable cause) {
            super(cause);
        }
    }
}
