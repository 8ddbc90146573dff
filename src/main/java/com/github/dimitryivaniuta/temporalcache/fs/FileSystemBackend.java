package com.github.dimitryivaniuta.temporalcache.fs;

import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Arrays;
import java.util.List;

/**
 * Operations a cached filesystem needs from the storage it wraps.
 *
 * <p>Paths are {@code /}-separated strings. A missing path raises {@link NoSuchFileException}
 * except for {@link #exists}, {@link #isDir} and {@link #isFile}, which answer {@code false}.
 */
public interface FileSystemBackend {

    /** Short scheme name, e.g. {@code "file"} or {@code "memory"}. */
    String protocol();

    byte[] catFile(String path) throws IOException;

    /**
     * Byte range of a file. {@code null} bounds mean start/end of file, negative bounds
     * count from the end.
     */
    default byte[] catFile(String path, Long start, Long end) throws IOException {
        byte[] all = catFile(path);
        int from = clampOffset(start, 0, all.length);
        int to = clampOffset(end, all.length, all.length);
        return to <= from ? new byte[0] : Arrays.copyOfRange(all, from, to);
    }

    default byte[] cat(String path) throws IOException {
        return catFile(path);
    }

    FileInfo info(String path) throws IOException;

    /** Direct children of a directory, sorted by name. */
    List<FileInfo> ls(String path) throws IOException;

    boolean exists(String path) throws IOException;

    default long size(String path) throws IOException {
        return info(path).size();
    }

    /** Changes whenever size, type or modification time change. */
    default long checksum(String path) throws IOException {
        String hex = ukey(path);
        return Long.parseUnsignedLong(hex.substring(0, 16), 16);
    }

    /** Hex digest identifying the current version of the file. */
    default String ukey(String path) throws IOException {
        FileInfo info = info(path);
        String fingerprint = protocol() + "|" + info.name() + "|" + info.size() + "|" + info.type() + "|" + info.modified();
        return DigestUtils.md5DigestAsHex(fingerprint.getBytes(StandardCharsets.UTF_8));
    }

    default boolean isDir(String path) throws IOException {
        try {
            return info(path).isDirectory();
        } catch (NoSuchFileException ex) {
            return false;
        }
    }

    default boolean isFile(String path) throws IOException {
        try {
            return info(path).isFile();
        } catch (NoSuchFileException ex) {
            return false;
        }
    }

    InputStream openRead(String path) throws IOException;

    /** Creates or truncates the file; contents become visible when the stream is closed. */
    OutputStream openWrite(String path) throws IOException;

    default void pipe(String path, byte[] data) throws IOException {
        try (OutputStream out = openWrite(path)) {
            out.write(data);
        }
    }

    private static int clampOffset(Long offset, int fallback, int length) {
        if (offset == null) return fallback;
        long o = offset < 0 ? length + offset : offset;
        return (int) Math.max(0, Math.min(length, o));
    }
}
