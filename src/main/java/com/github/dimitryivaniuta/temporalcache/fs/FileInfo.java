package com.github.dimitryivaniuta.temporalcache.fs;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record FileInfo(String name, long size, Type type, Instant modified) {

    public enum Type { FILE, DIRECTORY }

    public static FileInfo file(String name, long size, Instant modified) {
        return new FileInfo(name, size, Type.FILE, modified);
    }

    public static FileInfo directory(String name, Instant modified) {
        return new FileInfo(name, 0, Type.DIRECTORY, modified);
    }

    @JsonIgnore
    public boolean isFile() {
        return type == Type.FILE;
    }

    @JsonIgnore
    public boolean isDirectory() {
        return type == Type.DIRECTORY;
    }
}
