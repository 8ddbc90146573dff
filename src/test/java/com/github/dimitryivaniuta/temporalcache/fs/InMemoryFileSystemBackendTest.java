package com.github.dimitryivaniuta.temporalcache.fs;

import com.github.dimitryivaniuta.temporalcache.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class InMemoryFileSystemBackendTest {

    private final MutableClock clock = new MutableClock();
    private final InMemoryFileSystemBackend fs = new InMemoryFileSystemBackend(clock);

    @Test
    void shouldPublishContentOnClose() throws IOException {
        OutputStream out = fs.openWrite("/a.txt");
        out.write("hello".getBytes(StandardCharsets.UTF_8));
        assertThat(fs.exists("/a.txt")).isFalse();

        out.close();

        assertThat(fs.catFile("memory:///a.txt")).isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
        assertThat(fs.size("a.txt")).isEqualTo(5);
    }

    @Test
    void shouldListDirectChildrenWithImplicitDirectories() throws IOException {
        fs.pipe("/data/a.csv", new byte[]{1});
        fs.pipe("/data/sub/b.csv", new byte[]{1, 2});
        fs.pipe("/top.txt", new byte[0]);

        assertThat(fs.ls("/")).extracting(FileInfo::name).containsExactly("/data", "/top.txt");
        assertThat(fs.ls("/data/")).extracting(FileInfo::name, FileInfo::type).containsExactly(
                tuple("/data/a.csv", FileInfo.Type.FILE),
                tuple("/data/sub", FileInfo.Type.DIRECTORY));
        assertThat(fs.isDir("/data")).isTrue();
        assertThat(fs.isFile("/data")).isFalse();
    }

    @Test
    void shouldChangeUkeyWhenFileChanges() throws IOException {
        fs.pipe("/k.txt", new byte[]{1});
        String before = fs.ukey("/k.txt");
        long checksum = fs.checksum("/k.txt");

        clock.advance(Duration.ofSeconds(1));
        fs.pipe("/k.txt", new byte[]{2});

        assertThat(fs.ukey("/k.txt")).isNotEqualTo(before);
        assertThat(fs.checksum("/k.txt")).isNotEqualTo(checksum);
    }

    @Test
    void shouldReportMissingPaths() throws IOException {
        assertThatThrownBy(() -> fs.catFile("/nope")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> fs.info("/nope")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> fs.ls("/nope")).isInstanceOf(NoSuchFileException.class);
        assertThat(fs.exists("/nope")).isFalse();
        assertThat(fs.isFile("/nope")).isFalse();
    }

    @Test
    void shouldDeleteFiles() throws IOException {
        fs.pipe("/gone.txt", new byte[]{1});

        assertThat(fs.delete("/gone.txt")).isTrue();
        assertThat(fs.delete("/gone.txt")).isFalse();
        assertThat(fs.exists("/gone.txt")).isFalse();
    }
}
