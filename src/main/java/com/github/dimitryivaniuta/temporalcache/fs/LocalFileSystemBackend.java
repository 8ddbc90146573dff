package com.github.dimitryivaniuta.temporalcache.fs;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Local disk below a root directory. {@code "/a/b.txt"} maps to {@code <root>/a/b.txt};
 * paths escaping the root are rejected.
 */
public class LocalFileSystemBackend implements FileSystemBackend {

    private final Path root;

    public LocalFileSystemBackend(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public String protocol() {
        return "file";
    }

    public Path root() {
        return root;
    }

    @Override
    public byte[] catFile(String path) throws IOException {
        return Files.readAllBytes(resolve(path));
    }

    @Override
    public FileInfo info(String path) throws IOException {
        return info(resolve(path));
    }

    @Override
    public List<FileInfo> ls(String path) throws IOException {
        Path dir = resolve(path);
        if (!Files.isDirectory(dir)) {
            return List.of(info(dir));
        }
        List<FileInfo> out = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : children.sorted(Comparator.comparing(Path::toString)).toList()) {
                out.add(info(child));
            }
        }
        return out;
    }

    @Override
    public boolean exists(String path) throws IOException {
        return Files.exists(resolve(path));
    }

    @Override
    public InputStream openRead(String path) throws IOException {
        return Files.newInputStream(resolve(path));
    }

    @Override
    public OutputStream openWrite(String path) throws IOException {
        Path target = resolve(path);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newOutputStream(target);
    }

    private FileInfo info(Path p) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
        String name = toName(p);
        return attrs.isDirectory()
                ? FileInfo.directory(name, attrs.lastModifiedTime().toInstant())
                : FileInfo.file(name, attrs.size(), attrs.lastModifiedTime().toInstant());
    }

    private Path resolve(String path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        String relative = path.startsWith("file://") ? path.substring("file://".length()) : path;
        while (relative.startsWith("/")) relative = relative.substring(1);
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new AccessDeniedException(path, null, "outside of " + root);
        }
        return resolved;
    }

    private String toName(Path p) {
        String rel = root.relativize(p).toString().replace('\\', '/');
        return "/" + rel;
    }

    @Override
    public String toString() {
        return "LocalFileSystemBackend(" + root + ")";
    }
}
