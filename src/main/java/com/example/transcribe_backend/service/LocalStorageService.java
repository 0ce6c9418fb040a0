package com.example.transcribe_backend.service;

import com.example.transcribe_backend.exception.StorageException;
import com.example.transcribe_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed storage. Objects live under the base directory and are addressed by {@code file:} URIs.
 */
public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;

    public LocalStorageService(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.baseDir);
            LOGGER.info("LocalStorageService ready. base={}", this.baseDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + this.baseDir, e);
        }
    }

    @Override
    public StoredObject upload(byte[] content, String logicalPath, String contentType) {
        if (content == null) {
            throw new StorageException("content is null for " + logicalPath);
        }
        Path target = safeResolve(logicalPath);
        Path tmp = target.resolveSibling(target.getFileName().toString() + ".part");
        try {
            Files.createDirectories(target.getParent());
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Upload failed to " + target, e);
        }
        LOGGER.debug("Stored object key={} bytes={} contentType={}", logicalPath, content.length, contentType);
        return new StoredObject(normalizeKey(logicalPath), target.toUri());
    }

    @Override
    public boolean exists(String logicalPath) {
        return Files.exists(safeResolve(logicalPath));
    }

    @Override
    public Path resolve(String logicalPath) {
        return safeResolve(logicalPath);
    }

    private Path safeResolve(String logicalPath) {
        if (logicalPath == null || logicalPath.isBlank()) {
            throw new StorageException("logicalPath is blank");
        }
        Path p = baseDir.resolve(normalizeKey(logicalPath)).normalize();
        if (!p.startsWith(baseDir) || p.equals(baseDir)) {
            throw new StorageException("Invalid logicalPath (path traversal?): " + logicalPath);
        }
        return p;
    }

    // forward slashes, no leading slash
    private static String normalizeKey(String logicalPath) {
        return logicalPath.replace('\\', '/').replaceAll("^/+", "");
    }
}
