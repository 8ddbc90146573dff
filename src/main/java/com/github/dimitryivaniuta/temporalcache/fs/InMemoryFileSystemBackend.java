package com.github.dimitryivaniuta.temporalcache.fs;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local filesystem kept in a sorted map. Directories are implicit:
 * a path is a directory when some file lives below it. {@code "/"} always exists.
 */
public class InMemoryFileSystemBackend implements FileSystemBackend {

    private final ConcurrentSkipListMap<String, StoredFile> files = new ConcurrentSkipListMap<>();
    private final Clock clock;

    public InMemoryFileSystemBackend() {
        this(Clock.systemUTC());
    }

    public InMemoryFileSystemBackend(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String protocol() {
        return "memory";
    }

    @Override
    public byte[] catFile(String path) throws IOException {
        return file(normalize(path)).data().clone();
    }

    @Override
    public FileInfo info(String path) throws IOException {
        String p = normalize(path);
        StoredFile f = files.get(p);
        if (f != null) {
            return FileInfo.file(p, f.data().length, f.modified());
        }
        if (isImplicitDirectory(p)) {
            return FileInfo.directory(p, null);
        }
        throw new NoSuchFileException(path);
    }

    @Override
    public List<FileInfo> ls(String path) throws IOException {
        String dir = normalize(path);
        if (files.containsKey(dir)) {
            return List.of(info(dir));
        }
        if (!isImplicitDirectory(dir)) {
            throw new NoSuchFileException(path);
        }

        String prefix = dir.equals("/") ? "/" : dir + "/";
        Map<String, FileInfo> children = new TreeMap<>();
        for (Map.Entry<String, StoredFile> e : below(prefix).entrySet()) {
            String rest = e.getKey().substring(prefix.length());
            int slash = rest.indexOf('/');
            if (slash < 0) {
                children.put(e.getKey(), FileInfo.file(e.getKey(), e.getValue().data().length, e.getValue().modified()));
            } else {
                String child = prefix + rest.substring(0, slash);
                children.putIfAbsent(child, FileInfo.directory(child, null));
            }
        }
        return new ArrayList<>(children.values());
    }

    @Override
    public boolean exists(String path) {
        String p = normalize(path);
        return files.containsKey(p) || isImplicitDirectory(p);
    }

    @Override
    public InputStream openRead(String path) throws IOException {
        return new ByteArrayInputStream(file(normalize(path)).data());
    }

    @Override
    public OutputStream openWrite(String path) {
        String p = normalize(path);
        return new ByteArrayOutputStream() {
            private boolean closed;

            @Override
            public void close() {
                if (closed) return;
                closed = true;
                files.put(p, new StoredFile(toByteArray(), clock.instant()));
            }
        };
    }

    public boolean delete(String path) {
        return files.remove(normalize(path)) != null;
    }

    private StoredFile file(String p) throws NoSuchFileException {
        StoredFile f = files.get(p);
        if (f == null) throw new NoSuchFileException(p);
        return f;
    }

    private boolean isImplicitDirectory(String p) {
        if (p.equals("/")) return true;
        return !below(p + "/").isEmpty();
    }

    private NavigableMap<String, StoredFile> below(String prefix) {
        return files.subMap(prefix, true, prefix + Character.MAX_VALUE, false);
    }

    static String normalize(String path) {
        Objects.requireNonNull(path, "path must not be null");
        String p = path.startsWith("memory://") ? path.substring("memory://".length()) : path;
        if (!p.startsWith("/")) p = "/" + p;
        while (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    private record StoredFile(byte[] data, Instant modified) {}
}
