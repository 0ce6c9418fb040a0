package com.example.transcribe_backend.service.progress;

import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.util.JobStatus;

import java.util.UUID;

/**
 * What a reader sees of a job, whether it came from the live table or the durable row.
 */
public record JobStatusView(
        UUID jobId,
        JobStatus status,
        int pct,
        String statusMessage,
        String currentStage,
        String processingMethod,
        String resultsReference,
        String errorMessage
) {
    static JobStatusView of(JobProgress p) {
        return new JobStatusView(p.jobId(), p.status(), p.pct(), p.message(), p.stage(),
                p.processingMethod(), p.resultsReference(), p.errorMessage());
    }

    static JobStatusView of(Job job) {
        return new JobStatusView(job.getId(), job.getStatus(), job.getPct(), job.getStatusMessage(),
                job.getCurrentStage(), job.getProcessingMethod(), job.getResultsReference(), job.getErrorMessage());
    }
}
