package com.example.transcribe_backend.service.download;

import java.nio.file.Path;
import java.util.List;

/**
 * @param audioPath       non-empty downloaded audio file.
 * @param title           best-effort title, {@code "Unknown Title"} when metadata lookup failed.
 * @param durationSeconds best-effort duration, 0 when unknown.
 * @param method          name of the winning strategy.
 * @param attempts        every strategy's outcome in the order tried.
 */
public record DownloadResult(
        Path audioPath,
        String title,
        int durationSeconds,
        String method,
        List<DownloadAttempt> attempts
) {
    public DownloadResult {
        attempts = List.copyOf(attempts);
    }
}
