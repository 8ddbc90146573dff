package com.github.dimitryivaniuta.temporalcache.fs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.temporalcache.engine.CacheSwitch;
import com.github.dimitryivaniuta.temporalcache.engine.TemporalGateFactory;
import com.github.dimitryivaniuta.temporalcache.policy.CacheParams;
import com.github.dimitryivaniuta.temporalcache.policy.PolicyResolver;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;

/**
 * A {@link FileSystemBackend} with temporal caching of its read operations.
 *
 * <p>Which paths are cached, for how long and how many entries, comes from the
 * {@link PolicyResolver}. Example policy:
 * <pre>
 *   paths:   /config.json  -> 24 hours
 *   globs:   *.parquet     -> 1 hour
 *   regex:   \.tmp$        -> 30 seconds
 *   default:               -> 1 hour
 * </pre>
 *
 * Writes pass through and do not invalidate; cached reads of a rewritten file stay until
 * their window elapses or {@link #clearCache} is called.
 */
public class CachedFileSystem implements FileSystemBackend {

    private final FileSystemBackend delegate;
    private final CacheRouter router;
    private final CacheSwitch cacheSwitch;

    public CachedFileSystem(FileSystemBackend delegate,
                            PolicyResolver resolver,
                            TemporalGateFactory gateFactory,
                            ObjectMapper snapshotMapper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.router = new CacheRouter(delegate, resolver, gateFactory, snapshotMapper);
        this.cacheSwitch = gateFactory.cacheSwitch();
    }

    @Override
    public String protocol() {
        return delegate.protocol();
    }

    @Override
    public byte[] catFile(String path) throws IOException {
        return copyOf(router.dispatch(FsOperations.CAT_FILE, path));
    }

    @Override
    public byte[] catFile(String path, Long start, Long end) throws IOException {
        return copyOf(router.dispatch(FsOperations.CAT_FILE, path, start, end));
    }

    @Override
    public byte[] cat(String path) throws IOException {
        return copyOf(router.dispatch(FsOperations.CAT, path));
    }

    @Override
    public FileInfo info(String path) throws IOException {
        return router.dispatch(FsOperations.INFO, path);
    }

    @Override
    public List<FileInfo> ls(String path) throws IOException {
        return router.dispatch(FsOperations.LS, path);
    }

    @Override
    public boolean exists(String path) throws IOException {
        return router.dispatch(FsOperations.EXISTS, path);
    }

    @Override
    public long size(String path) throws IOException {
        return router.dispatch(FsOperations.SIZE, path);
    }

    @Override
    public long checksum(String path) throws IOException {
        return router.dispatch(FsOperations.CHECKSUM, path);
    }

    @Override
    public String ukey(String path) throws IOException {
        return router.dispatch(FsOperations.UKEY, path);
    }

    @Override
    public boolean isDir(String path) throws IOException {
        return router.dispatch(FsOperations.IS_DIR, path);
    }

    @Override
    public boolean isFile(String path) throws IOException {
        return router.dispatch(FsOperations.IS_FILE, path);
    }

    /** Served from the cached {@link #catFile(String)} when the path has a policy. */
    @Override
    public InputStream openRead(String path) throws IOException {
        CacheParams params = router.resolver().resolve(path);
        if (!params.isEmpty() && cacheSwitch.isEnabled()) {
            return new ByteArrayInputStream(catFile(path));
        }
        return delegate.openRead(path);
    }

    // cached arrays are shared between callers, so every caller gets its own copy
    private static byte[] copyOf(byte[] cached) {
        return cached == null ? null : cached.clone();
    }

    @Override
    public OutputStream openWrite(String path) throws IOException {
        return delegate.openWrite(path);
    }

    @Override
    public void pipe(String path, byte[] data) throws IOException {
        delegate.pipe(path, data);
    }

    /** Clears everything cached under the policy of {@code path}, including other paths sharing it. */
    public void clearCache(String path) {
        router.invalidate(path);
    }

    public void clearCache() {
        router.invalidate();
    }

    public CacheRouter router() {
        return router;
    }

    public FileSystemBackend backend() {
        return delegate;
    }

    @Override
    public String toString() {
        return "CachedFileSystem(" + delegate.protocol() + ", cacheConfig=" + router.resolver().rules() + ")";
    }
}
