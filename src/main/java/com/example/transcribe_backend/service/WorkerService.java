package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.WorkerProperties;
import com.example.transcribe_backend.exception.PersistenceException;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.service.progress.ProgressTracker;
import com.example.transcribe_backend.service.tier.TierRequest;
import com.example.transcribe_backend.service.tier.TieredProcessingOrchestrator;
import com.example.transcribe_backend.service.tier.TranscriptionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single consumer of the job queue. Claims the oldest queued job, drives it through the tiers and records
 * a terminal state. One job's failure never stops the loop.
 */
@Service
public class WorkerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);

    private final JobService jobService;
    private final ProgressTracker progress;
    private final TieredProcessingOrchestrator orchestrator;
    private final WorkDirectoryService workDirs;
    private final WorkerProperties workerProperties;
    private final Clock clock;

    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private volatile Instant lastHeartbeat;

    public WorkerService(JobService jobService,
                         ProgressTracker progress,
                         TieredProcessingOrchestrator orchestrator,
                         WorkDirectoryService workDirs,
                         WorkerProperties workerProperties,
                         Clock clock) {
        this.jobService = jobService;
        this.progress = progress;
        this.orchestrator = orchestrator;
        this.workDirs = workDirs;
        this.workerProperties = workerProperties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${worker.poll-interval-ms:5000}")
    public void poll() {
        heartbeat();
        if (!busy.compareAndSet(false, true)) {
            LOGGER.debug("Worker poll tick - previous job still running");
            return;
        }
        try {
            Optional<Job> claimed;
            try {
                claimed = jobService.claimNextQueued();
            } catch (PersistenceException e) {
                LOGGER.warn("Worker poll failed to claim job error={}", e.getMessage());
                return;
            }
            if (claimed.isEmpty()) {
                LOGGER.debug("Worker poll tick - no queued jobs");
                return;
            }
            runJob(claimed.get());
        } finally {
            busy.set(false);
        }
    }

    void runJob(Job job) {
        UUID jobId = job.getId();
        long t0 = System.nanoTime();
        LOGGER.info("JOB START jobId={} source={}", jobId, job.getSourceReference());
        progress.start(jobId);
        boolean ok = false;
        try {
            Path workDir = workDirs.create(jobId);
            TranscriptionOutcome outcome = orchestrator.process(
                    new TierRequest(jobId, job.getSourceReference(), job.getModelPreference(), workDir));
            recordMetadata(jobId, outcome);
            progress.complete(jobId, outcome.resultsReference(), outcome.processingMethod());
            ok = true;
        } catch (Exception e) {
            LOGGER.error("Job {} failed: {}", jobId, e.toString(), e);
            try {
                progress.fail(jobId, errorMessage(e));
            } catch (RuntimeException inner) {
                LOGGER.error("Job {} could not be marked failed: {}", jobId, inner.toString());
            }
        } finally {
            workDirs.release(jobId);
            processed.incrementAndGet();
            LOGGER.info("JOB {} jobId={} in={}ms", ok ? "DONE" : "FAILED", jobId, (System.nanoTime() - t0) / 1_000_000);
        }
    }

    private void recordMetadata(UUID jobId, TranscriptionOutcome outcome) {
        if (outcome.title() == null) {
            return;
        }
        try {
            jobService.updateMetadata(jobId, outcome.title(), outcome.durationSeconds());
        } catch (PersistenceException e) {
            LOGGER.warn("Metadata write failed jobId={} error={}", jobId, e.getMessage());
        }
    }

    private void heartbeat() {
        Instant now = Instant.now(clock);
        Duration interval = workerProperties.getHeartbeatInterval();
        if (lastHeartbeat == null || !now.isBefore(lastHeartbeat.plus(interval))) {
            lastHeartbeat = now;
            LOGGER.info("Worker heartbeat busy={} processed={}", busy.get(), processed.get());
        }
    }

    static String errorMessage(Throwable e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }

    public boolean isBusy() {
        return busy.get();
    }
}
