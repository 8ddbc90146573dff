package com.github.dimitryivaniuta.temporalcache.proxy;

import com.github.dimitryivaniuta.temporalcache.config.TemporalCacheProperties;
import com.github.dimitryivaniuta.temporalcache.policy.CacheConfigurationException;
import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;
import com.github.dimitryivaniuta.temporalcache.proxy.annotations.TemporalCached;
import com.github.dimitryivaniuta.temporalcache.proxy.support.MethodKeySupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.Advised;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.Ordered;
import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Set;

/**
 * Wraps beans that use {@link TemporalCached} in a runtime proxy (ProxyFactory)
 * carrying the {@link MethodCacheInterceptor}.
 *
 * <p>Not @Aspect-based AOP: custom proxy wiring via BeanPostProcessor. Annotation
 * settings are validated here, so a bad duration fails startup instead of the first call.
 * The interceptor is resolved on first use, keeping its metrics dependencies out of the
 * post-processor bootstrap.
 */
@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
@EnableConfigurationProperties(TemporalCacheProperties.class)
public final class TemporalCacheBeanPostProcessor implements BeanPostProcessor {

    private static final Set<Class<?>> SNAPSHOT_KEY_SCALARS = Set.of(
            String.class, Boolean.class, Long.class, Integer.class, Short.class, Byte.class, Double.class, Float.class);

    private final TemporalCacheProperties props;
    private final ObjectProvider<MethodCacheInterceptor> interceptor;

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
        Class<?> targetClass = ClassUtils.getUserClass(bean);
        if (isExcluded(targetClass)) return bean;
        if (!needsProxy(targetClass)) return bean;

        validate(targetClass);
        MethodCacheInterceptor advice = interceptor.getObject();

        // If already proxied (e.g., @Transactional), add advice to existing proxy
        if (bean instanceof Advised advised) {
            advised.addAdvice(0, advice);
            return bean;
        }

        ProxyFactory pf = new ProxyFactory(bean);
        // allow class-based proxying for beans without interfaces
        pf.setProxyTargetClass(true);
        pf.addAdvice(advice);

        log.debug("Temporal cache proxy created for bean {}", beanName);
        return pf.getProxy();
    }

    private static boolean needsProxy(Class<?> targetClass) {
        if (AnnotatedElementUtils.hasAnnotation(targetClass, TemporalCached.class)) return true;
        for (Method m : targetClass.getMethods()) {
            if (AnnotatedElementUtils.hasAnnotation(m, TemporalCached.class)) return true;
        }
        return false;
    }

    static void validate(Class<?> targetClass) {
        for (Method m : targetClass.getMethods()) {
            TemporalCached ann = MethodCacheInterceptor.find(targetClass, m);
            if (ann != null && ann.enabled() && m.getDeclaringClass() != Object.class) {
                CacheParams params = MethodCacheInterceptor.toParams(ann);
                if (params.isPersistent()) {
                    validateSnapshotKeys(targetClass, m);
                }
            }
        }
    }

    /**
     * Persistent caches key entries by arguments read back from JSON, so every parameter must
     * come back equal to the live value: strings, booleans, numbers, or lists/arrays of them.
     */
    private static void validateSnapshotKeys(Class<?> targetClass, Method m) {
        for (int i = 0; i < m.getParameterCount(); i++) {
            ResolvableType type = ResolvableType.forMethodParameter(m, i, targetClass);
            if (!isSnapshotKeyType(type)) {
                throw new CacheConfigurationException("Persistent cache on " + MethodKeySupport.signature(targetClass, m)
                        + " cannot restore parameter " + i + " of type " + type
                        + "; use strings, booleans, numbers or lists of them");
            }
        }
    }

    private static boolean isSnapshotKeyType(ResolvableType type) {
        Class<?> raw = type.resolve(Object.class);
        if (raw.isArray()) {
            return !raw.getComponentType().isPrimitive() && isSnapshotKeyType(type.getComponentType());
        }
        if (List.class.isAssignableFrom(raw)) {
            return isSnapshotKeyType(type.asCollection().getGeneric(0));
        }
        Class<?> boxed = ClassUtils.resolvePrimitiveIfNecessary(raw);
        return SNAPSHOT_KEY_SCALARS.contains(boxed);
    }

    private boolean isExcluded(Class<?> targetClass) {
        String name = targetClass.getName();

        if (name.startsWith("org.springframework.") || name.startsWith("jakarta.") || name.startsWith("java.")) {
            return true;
        }

        if (props.getExcludePackages() == null || props.getExcludePackages().isEmpty()) return false;

        for (String p : props.getExcludePackages()) {
            if (p == null || p.isBlank()) continue;
            String prefix = p.endsWith(".") ? p : p + ".";
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}
