package com.example.transcribe_backend.service.progress;

import com.example.transcribe_backend.util.JobStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Live progress entry of one job. Immutable; the store swaps whole entries.
 */
public record JobProgress(
        UUID jobId,
        JobStatus status,
        int pct,
        String message,
        String stage,
        String processingMethod,
        String resultsReference,
        String errorMessage,
        Instant updatedAt
) {
    static JobProgress started(UUID jobId, Instant now) {
        return new JobProgress(jobId, JobStatus.PROCESSING, 0, "Starting", "queued", null, null, null, now);
    }

    JobProgress advance(int newPct, String newMessage, String newStage, String newMethod, Instant now) {
        return new JobProgress(jobId, status, newPct, newMessage,
                newStage != null ? newStage : stage,
                newMethod != null ? newMethod : processingMethod,
                resultsReference, errorMessage, now);
    }
}
