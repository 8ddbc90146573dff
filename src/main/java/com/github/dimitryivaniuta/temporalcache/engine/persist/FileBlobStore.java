package com.github.dimitryivaniuta.temporalcache.engine.persist;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores blobs as files on the local filesystem.
 *
 * <p>Writes go to a temporary sibling first and are then moved over the target,
 * so a crash mid-write leaves the previous snapshot in place.
 */
@Slf4j
public class FileBlobStore implements BlobStore {

    @Override
    public Optional<byte[]> read(String location) {
        Path path = Path.of(location);
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (IOException ex) {
            throw new SnapshotPersistenceException("Cannot read snapshot " + location, ex);
        }
    }

    @Override
    public void write(String location, byte[] blob) {
        Path target = Path.of(location).toAbsolutePath();
        Path tmp = null;
        try {
            Path dir = target.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            Files.write(tmp, blob);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            deleteQuietly(tmp);
            throw new SnapshotPersistenceException("Cannot write snapshot " + location, ex);
        }
    }

    @Override
    public void delete(String location) {
        try {
            Files.deleteIfExists(Path.of(location));
        } catch (IOException ex) {
            throw new SnapshotPersistenceException("Cannot delete snapshot " + location, ex);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ex) {
            log.debug("Leftover temporary snapshot {}", tmp, ex);
        }
    }
}
