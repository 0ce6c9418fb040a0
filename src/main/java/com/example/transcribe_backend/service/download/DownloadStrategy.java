package com.example.transcribe_backend.service.download;

import com.example.transcribe_backend.config.DownloaderProperties;

import java.time.Duration;

/**
 * One way of fetching audio with yt-dlp.
 *
 * @param name          identifier recorded on the job, e.g. {@code unauthenticated-m4a}.
 * @param description   human-readable summary for logs.
 * @param format        yt-dlp format selector.
 * @param requiresAuth  strategy only runs when credential material exists.
 * @param clientProfile yt-dlp player client to impersonate, may be {@code null}.
 * @param timeout       hard limit for the subprocess.
 * @param retries       yt-dlp internal retry count.
 */
public record DownloadStrategy(
        String name,
        String description,
        String format,
        boolean requiresAuth,
        String clientProfile,
        Duration timeout,
        int retries
) {
    public static DownloadStrategy from(DownloaderProperties.Strategy s) {
        if (s.getName() == null || s.getName().isBlank()) {
            throw new IllegalArgumentException("download strategy without name");
        }
        if (s.getFormat() == null || s.getFormat().isBlank()) {
            throw new IllegalArgumentException("download strategy " + s.getName() + " has no format selector");
        }
        return new DownloadStrategy(
                s.getName(),
                s.getDescription() == null ? s.getName() : s.getDescription(),
                s.getFormat(),
                s.isRequiresAuth(),
                s.getClientProfile(),
                Duration.ofSeconds(Math.max(1, s.getTimeoutSeconds())),
                Math.max(0, s.getRetries()));
    }
}
