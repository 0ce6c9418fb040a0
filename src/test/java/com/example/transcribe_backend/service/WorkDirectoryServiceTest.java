package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.WorkerProperties;
import com.example.transcribe_backend.util.CleanupPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkDirectoryServiceTest {

    @TempDir
    private Path tempDir;

    @Test
    void immediatePolicyDeletesJobDirectoryOnRelease() throws IOException {
        WorkDirectoryService workDirs = new WorkDirectoryService(props(CleanupPolicy.IMMEDIATE));
        UUID jobId = UUID.randomUUID();
        Path dir = workDirs.create(jobId);
        Files.createDirectories(dir.resolve("download"));
        Files.writeString(dir.resolve("download/audio_1.mp3"), "x");

        workDirs.release(jobId);

        assertFalse(Files.exists(dir));
    }

    @Test
    void onShutdownPolicyKeepsDirectoriesUntilPurge() throws IOException {
        WorkDirectoryService workDirs = new WorkDirectoryService(props(CleanupPolicy.ON_SHUTDOWN));
        UUID jobId = UUID.randomUUID();
        Path dir = workDirs.create(jobId);
        Files.writeString(dir.resolve("audio.mp3"), "x");

        workDirs.release(jobId);
        assertTrue(Files.exists(dir));

        workDirs.purgeOnShutdown();
        assertFalse(Files.exists(dir));
        assertTrue(Files.isDirectory(workDirs.root()));
    }

    @Test
    void releasingUnknownJobIsHarmless() {
        WorkDirectoryService workDirs = new WorkDirectoryService(props(CleanupPolicy.IMMEDIATE));

        workDirs.release(UUID.randomUUID());

        assertTrue(Files.isDirectory(tempDir));
    }

    private WorkerProperties props(CleanupPolicy policy) {
        WorkerProperties props = new WorkerProperties();
        props.setWorkDir(tempDir.resolve("work").toString());
        props.getCleanup().setPolicy(policy);
        return props;
    }
}
