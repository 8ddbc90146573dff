package com.github.dimitryivaniuta.temporalcache.web;

import com.github.dimitryivaniuta.temporalcache.fs.CachedFileSystem;
import com.github.dimitryivaniuta.temporalcache.fs.FileInfo;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

/**
 * Read-only view of the configured backend, served through the temporal cache.
 */
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/fs")
public class FileSystemController {

    private final CachedFileSystem fileSystem;

    public record ExistsResponse(String path, boolean exists) {}

    @GetMapping("/cat")
    public ResponseEntity<byte[]> cat(@RequestParam @NotBlank String path,
                                      @RequestParam(required = false) Long start,
                                      @RequestParam(required = false) Long end) throws IOException {
        byte[] body = (start == null && end == null)
                ? fileSystem.catFile(path)
                : fileSystem.catFile(path, start, end);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(body);
    }

    @GetMapping("/ls")
    public List<FileInfo> ls(@RequestParam @NotBlank String path) throws IOException {
        return fileSystem.ls(path);
    }

    @GetMapping("/info")
    public FileInfo info(@RequestParam @NotBlank String path) throws IOException {
        return fileSystem.info(path);
    }

    @GetMapping("/exists")
    public ExistsResponse exists(@RequestParam @NotBlank String path) throws IOException {
        return new ExistsResponse(path, fileSystem.exists(path));
    }
}
