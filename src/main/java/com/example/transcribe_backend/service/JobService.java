package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.WorkerProperties;
import com.example.transcribe_backend.exception.PersistenceException;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.model.ProcessingStep;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.util.JobStatus;
import com.example.transcribe_backend.util.PipelineStage;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Durable side of the job lifecycle. Every store failure surfaces as {@link PersistenceException}.
 */
@Service
public class JobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);
    static final String UNKNOWN_ERROR = "Unknown error";

    private final JobRepository jobRepo;
    private final WorkerProperties workerProperties;
    private final Clock clock;

    public JobService(JobRepository jobRepo, WorkerProperties workerProperties, Clock clock) {
        this.jobRepo = jobRepo;
        this.workerProperties = workerProperties;
        this.clock = clock;
    }

    @Transactional
    public Job enqueue(String sourceReference, @Nullable String modelPreference) {
        var job = new Job(sourceReference);
        job.setStatus(JobStatus.QUEUED);
        job.setStatusMessage("Queued");
        job.setCurrentStage(PipelineStage.QUEUED.label());
        job.setModelPreference(modelPreference == null || modelPreference.isBlank() ? null : modelPreference.strip());
        Job saved = persist("enqueue", () -> jobRepo.save(job));
        LOGGER.info("JOB ENQUEUED jobId={} source={}", saved.getId(), sourceReference);
        return saved;
    }

    public Optional<Job> findById(UUID id) {
        return persist("find " + id, () -> jobRepo.findById(id));
    }

    /**
     * Picks the oldest queued job and moves it to PROCESSING before any work happens.
     * A claim that loses the race (zero rows updated) returns empty.
     */
    public Optional<Job> claimNextQueued() {
        Optional<Job> candidate = persist("select queued", () -> jobRepo.findFirstByStatusOrderByCreatedAtAsc(JobStatus.QUEUED));
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        UUID id = candidate.get().getId();
        int claimed = persist("claim " + id,
                () -> jobRepo.markProcessing(id, "Processing started", PipelineStage.QUEUED.label(), now()));
        if (claimed != 1) {
            LOGGER.info("JOB CLAIM LOST jobId={}", id);
            return Optional.empty();
        }
        return findById(id);
    }

    public void updateProgress(UUID id, int pct, String message, @Nullable String stage, @Nullable String method) {
        persist("progress " + id, () -> jobRepo.updateProgress(id, pct, message, stage, method, now()));
    }

    public void updateMetadata(UUID id, String title, int durationSeconds) {
        persist("metadata " + id, () -> jobRepo.updateMetadata(id, title, durationSeconds, now()));
    }

    @Transactional
    public void appendStep(UUID id, ProcessingStep step) {
        persist("append step " + id, () -> {
            Job job = jobRepo.findById(id).orElseThrow(() -> new IllegalStateException("job not found"));
            List<ProcessingStep> log = new ArrayList<>(job.getProgressLog());
            log.add(step);
            job.setProgressLog(log);
            return jobRepo.save(job);
        });
    }

    /**
     * Final success write, retried with backoff before surfacing.
     */
    public void markCompleted(UUID id, String resultsReference, String processingMethod, String message) {
        if (resultsReference == null || resultsReference.isBlank()) {
            throw new IllegalArgumentException("resultsReference is required to complete job " + id);
        }
        withFinalWriteRetry("complete " + id,
                () -> jobRepo.markCompleted(id, resultsReference, processingMethod, message, now()));
    }

    /**
     * Final failure write, retried with backoff before surfacing.
     */
    public void markError(UUID id, @Nullable String errorMessage) {
        String msg = errorMessage == null || errorMessage.isBlank() ? UNKNOWN_ERROR : errorMessage;
        withFinalWriteRetry("error " + id, () -> jobRepo.markError(id, msg, now()));
    }

    private void withFinalWriteRetry(String op, Supplier<Integer> write) {
        int attempts = Math.max(1, workerProperties.getFinalWriteAttempts());
        Duration backoff = workerProperties.getFinalWriteBackoff();
        PersistenceException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                int rows = persist(op, write);
                if (rows == 1) {
                    return;
                }
                throw new PersistenceException("Final write '" + op + "' updated " + rows + " rows", null);
            } catch (PersistenceException e) {
                last = e;
                LOGGER.warn("FINAL WRITE FAIL op={} attempt={}/{} error={}", op, attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    sleep(backoff.multipliedBy(attempt));
                }
            }
        }
        throw last;
    }

    private <T> T persist(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("Job store operation '" + op + "' failed: " + e.getMessage(), e);
        }
    }

    private void sleep(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            return;
        }
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException("Interrupted while retrying final write", e);
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
