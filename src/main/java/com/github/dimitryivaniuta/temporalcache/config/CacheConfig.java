package com.github.dimitryivaniuta.temporalcache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.temporalcache.engine.CacheSwitch;
import com.github.dimitryivaniuta.temporalcache.engine.TemporalGateFactory;
import com.github.dimitryivaniuta.temporalcache.engine.persist.BlobStore;
import com.github.dimitryivaniuta.temporalcache.engine.persist.FileBlobStore;
import com.github.dimitryivaniuta.temporalcache.fs.CachedFileSystem;
import com.github.dimitryivaniuta.temporalcache.fs.FileSystemBackend;
import com.github.dimitryivaniuta.temporalcache.fs.InMemoryFileSystemBackend;
import com.github.dimitryivaniuta.temporalcache.fs.LocalFileSystemBackend;
import com.github.dimitryivaniuta.temporalcache.metrics.TemporalCacheMetrics;
import com.github.dimitryivaniuta.temporalcache.policy.PolicyResolver;
import com.github.dimitryivaniuta.temporalcache.proxy.MethodCacheInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wiring for the temporal cache engine:
 * - one gate factory shared by the filesystem router and the method interceptor
 * - policy rules bound from {@code temporal-cache.policy}
 * - the process-wide switch, initialised from {@code temporal-cache.enabled}
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TemporalCacheProperties.class)
public class CacheConfig {

    public static final String RAW_BACKEND = "fileSystemBackend";

    @Bean
    public Clock temporalCacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheSwitch cacheSwitch(TemporalCacheProperties props) {
        CacheSwitch cacheSwitch = CacheSwitch.global();
        if (props.isEnabled()) {
            cacheSwitch.enable();
        } else {
            cacheSwitch.disable();
            log.info("Temporal caching disabled by configuration");
        }
        return cacheSwitch;
    }

    @Bean
    public BlobStore snapshotBlobStore() {
        return new FileBlobStore();
    }

    @Bean
    public TemporalGateFactory temporalGateFactory(CacheSwitch cacheSwitch,
                                                   Clock temporalCacheClock,
                                                   BlobStore snapshotBlobStore,
                                                   TemporalCacheMetrics metrics) {
        return new TemporalGateFactory(cacheSwitch, temporalCacheClock, snapshotBlobStore, metrics);
    }

    @Bean
    public PolicyResolver policyResolver(TemporalCacheProperties props) {
        return new PolicyResolver(props.getPolicy().toRules(), props.getResolutionCacheSize());
    }

    /** The uncached backend; inject it with {@code @Qualifier(RAW_BACKEND)}. */
    @Bean(RAW_BACKEND)
    public FileSystemBackend fileSystemBackend(TemporalCacheProperties props) {
        if (props.getBackend() == TemporalCacheProperties.Backend.MEMORY) {
            return new InMemoryFileSystemBackend();
        }
        return new LocalFileSystemBackend(Path.of(props.getRoot()));
    }

    @Bean
    @Primary
    public CachedFileSystem cachedFileSystem(@Qualifier(RAW_BACKEND) FileSystemBackend fileSystemBackend,
                                             PolicyResolver policyResolver,
                                             TemporalGateFactory temporalGateFactory,
                                             ObjectMapper objectMapper) {
        CachedFileSystem fs = new CachedFileSystem(fileSystemBackend, policyResolver, temporalGateFactory, objectMapper);
        log.info("Temporal cache ready: {}", fs);
        return fs;
    }

    @Bean
    public MethodCacheInterceptor methodCacheInterceptor(TemporalGateFactory temporalGateFactory,
                                                         ObjectMapper objectMapper) {
        return new MethodCacheInterceptor(temporalGateFactory, objectMapper);
    }
}
