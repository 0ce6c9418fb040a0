package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.WorkerProperties;
import com.example.transcribe_backend.util.CleanupPolicy;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Owns {@code <worker.work-dir>/<jobId>} directories. With {@link CleanupPolicy#IMMEDIATE} a job's directory
 * goes as soon as the job is terminal; with {@link CleanupPolicy#ON_SHUTDOWN} the whole work dir is purged
 * when the context closes. Deletion failures are logged only.
 */
@Service
public class WorkDirectoryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkDirectoryService.class);

    private final Path root;
    private final CleanupPolicy policy;

    public WorkDirectoryService(WorkerProperties properties) {
        this.root = Path.of(properties.getWorkDir()).toAbsolutePath().normalize();
        this.policy = properties.getCleanup().getPolicy();
        LOGGER.info("Work directory root={} cleanupPolicy={}", root, policy);
    }

    public Path create(UUID jobId) throws IOException {
        return Files.createDirectories(root.resolve(jobId.toString()));
    }

    public void release(UUID jobId) {
        if (policy != CleanupPolicy.IMMEDIATE) {
            return;
        }
        deleteRecursively(root.resolve(jobId.toString()));
    }

    @PreDestroy
    public void purgeOnShutdown() {
        if (policy != CleanupPolicy.ON_SHUTDOWN || !Files.isDirectory(root)) {
            return;
        }
        LOGGER.info("Purging work directory root={}", root);
        try (Stream<Path> children = Files.list(root)) {
            children.forEach(this::deleteRecursively);
        } catch (IOException e) {
            LOGGER.warn("Failed to list work directory root={} error={}", root, e.toString());
        }
    }

    public Path root() {
        return root;
    }

    private void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(this::safeDelete);
        } catch (IOException e) {
            LOGGER.warn("Failed to walk work directory dir={} error={}", dir, e.toString());
        }
    }

    private void safeDelete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete path={} error={}", path, e.toString());
        }
    }
}
