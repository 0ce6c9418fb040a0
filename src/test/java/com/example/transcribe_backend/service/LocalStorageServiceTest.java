package com.example.transcribe_backend.service;

import com.example.transcribe_backend.exception.StorageException;
import com.example.transcribe_backend.service.Interfaces.StorageService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageServiceTest {

    @TempDir
    private Path tempDir;

    @Test
    void uploadWritesUnderBaseDirAndReturnsFileUri() throws Exception {
        LocalStorageService storage = new LocalStorageService(tempDir);

        StorageService.StoredObject stored = storage.upload("{}".getBytes(StandardCharsets.UTF_8),
                "/transcriptions/job-1/results.json", "application/json");

        Path file = tempDir.resolve("transcriptions/job-1/results.json");
        assertEquals("transcriptions/job-1/results.json", stored.key());
        assertEquals(file.toUri(), stored.uri());
        assertEquals("{}", Files.readString(file));
        assertTrue(storage.exists("transcriptions/job-1/results.json"));
        assertFalse(Files.exists(file.resolveSibling("results.json.part")));
    }

    @Test
    void uploadOverwritesExistingObject() throws Exception {
        LocalStorageService storage = new LocalStorageService(tempDir);
        storage.uploadText("first", "a/subtitles.srt", "application/x-subrip");

        storage.uploadText("second", "a/subtitles.srt", "application/x-subrip");

        assertEquals("second", Files.readString(storage.resolve("a/subtitles.srt")));
    }

    @Test
    void pathTraversalIsRejected() {
        LocalStorageService storage = new LocalStorageService(tempDir.resolve("data"));

        assertThrows(StorageException.class, () -> storage.upload(new byte[]{1}, "../escape.txt", "text/plain"));
        assertThrows(StorageException.class, () -> storage.resolve("a/../../escape.txt"));
        assertThrows(StorageException.class, () -> storage.resolve(" "));
        assertFalse(Files.exists(tempDir.resolve("escape.txt")));
    }
}
