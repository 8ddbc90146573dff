package com.github.dimitryivaniuta.temporalcache.fs;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/** The read operations {@link CachedFileSystem} routes through the cache. */
public final class FsOperations {

    private FsOperations() {
    }

    public static final FsOperation<byte[]> CAT_FILE = new FsOperation<>("catFile", new TypeReference<byte[]>() {},
            (fs, key) -> key.args().isEmpty()
                    ? fs.catFile(key.path())
                    : fs.catFile(key.path(), (Long) key.arg(0), (Long) key.arg(1)));

    public static final FsOperation<byte[]> CAT = new FsOperation<>("cat", new TypeReference<byte[]>() {},
            (fs, key) -> fs.cat(key.path()));

    public static final FsOperation<FileInfo> INFO = new FsOperation<>("info", new TypeReference<FileInfo>() {},
            (fs, key) -> fs.info(key.path()));

    public static final FsOperation<List<FileInfo>> LS = new FsOperation<>("ls", new TypeReference<List<FileInfo>>() {},
            (fs, key) -> fs.ls(key.path()));

    public static final FsOperation<Boolean> EXISTS = new FsOperation<>("exists", new TypeReference<Boolean>() {},
            (fs, key) -> fs.exists(key.path()));

    public static final FsOperation<Long> SIZE = new FsOperation<>("size", new TypeReference<Long>() {},
            (fs, key) -> fs.size(key.path()));

    public static final FsOperation<Long> CHECKSUM = new FsOperation<>("checksum", new TypeReference<Long>() {},
            (fs, key) -> fs.checksum(key.path()));

    public static final FsOperation<String> UKEY = new FsOperation<>("ukey", new TypeReference<String>() {},
            (fs, key) -> fs.ukey(key.path()));

    public static final FsOperation<Boolean> IS_DIR = new FsOperation<>("isDir", new TypeReference<Boolean>() {},
            (fs, key) -> fs.isDir(key.path()));

    public static final FsOperation<Boolean> IS_FILE = new FsOperation<>("isFile", new TypeReference<Boolean>() {},
            (fs, key) -> fs.isFile(key.path()));
}
