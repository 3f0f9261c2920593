package com.example.pageedit.infrastructure.storage;

import com.example.pageedit.config.PageEditProperties;
import com.example.pageedit.domain.model.PagePath;
import com.example.pageedit.domain.port.DocumentStorage;
import com.example.pageedit.infrastructure.exception.StorageException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link DocumentStorage} rooted at {@code pageedit.storage-root}.
 * Writes are staged into a temporary file next to the target and moved into place, so readers see
 * either the old or the new content.
 */
@Component
public class FileSystemDocumentStorage implements DocumentStorage {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentStorage.class);

    private final Path root;

    public FileSystemDocumentStorage(PageEditProperties properties) {
        this.root = properties.getStorageRoot().toAbsolutePath().normalize();
    }

    @Override
    public byte[] read(String path) {
        Path file = resolve(path);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StorageException("Unable to read " + path, e);
        }
    }

    @Override
    public void write(String path, byte[] bytes) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Path staged = Files.createTempFile(target.getParent(), ".staged-", ".tmp");
            try {
                Files.write(staged, bytes);
                moveIntoPlace(staged, target);
            } finally {
                Files.deleteIfExists(staged);
            }
        } catch (IOException e) {
            throw new StorageException("Unable to write " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public boolean copyPage(PagePath source, PagePath target) {
        Path sourceDir = resolve(source.sidecarDirectory());
        if (!Files.isDirectory(sourceDir)) {
            return false;
        }
        Path targetDir = resolve(target.sidecarDirectory());
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            List<Path> entries = walk.toList();
            for (Path entry : entries) {
                Path destination = targetDir.resolve(sourceDir.relativize(entry).toString());
                if (Files.isDirectory(entry)) {
                    Files.createDirectories(destination);
                } else {
                    Files.createDirectories(destination.getParent());
                    Files.copy(entry, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
            log.debug("Copied artifacts {} -> {}", source.sidecarDirectory(), target.sidecarDirectory());
            return true;
        } catch (IOException e) {
            throw new StorageException("Unable to copy page artifacts from " + source.sidecarDirectory()
                    + " to " + target.sidecarDirectory(), e);
        }
    }

    private void moveIntoPlace(Path staged, Path target) throws IOException {
        try {
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new StorageException("Path escapes the storage root: " + path,
                    new IllegalArgumentException(path));
        }
        return resolved;
    }
}
