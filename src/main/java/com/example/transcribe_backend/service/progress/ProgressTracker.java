package com.example.transcribe_backend.service.progress;

import com.example.transcribe_backend.config.WorkerProperties;
import com.example.transcribe_backend.exception.PersistenceException;
import com.example.transcribe_backend.model.ProcessingStep;
import com.example.transcribe_backend.service.JobService;
import com.example.transcribe_backend.util.JobStatus;
import com.example.transcribe_backend.util.PipelineStage;
import com.example.transcribe_backend.util.ProcessingMethod;
import com.example.transcribe_backend.util.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One read path over the live progress table and the durable job row.
 * <p>
 * Live updates are frequent and go to both stores; a durable failure there is only logged.
 * Terminal transitions write the durable row first, then mirror the state into the live table,
 * and evict the live entry after the grace period.
 */
@Service
public class ProgressTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);

    private final ProgressStore store;
    private final JobService jobService;
    private final TaskScheduler scheduler;
    private final WorkerProperties workerProperties;
    private final Clock clock;

    public ProgressTracker(ProgressStore store, JobService jobService, TaskScheduler scheduler,
                           WorkerProperties workerProperties, Clock clock) {
        this.store = store;
        this.jobService = jobService;
        this.scheduler = scheduler;
        this.workerProperties = workerProperties;
        this.clock = clock;
    }

    public void start(UUID jobId) {
        store.put(JobProgress.started(jobId, Instant.now(clock)));
    }

    /**
     * Clamps {@code pct} to [0,100] and never lowers it. Updates for a job without a live entry or with a
     * terminal entry are ignored.
     */
    public void update(UUID jobId, int pct, String message, PipelineStage stage, ProcessingMethod method) {
        int bounded = Math.max(0, Math.min(100, pct));
        String stageLabel = stage == null ? null : stage.label();
        String methodTag = method == null ? null : method.tag();
        JobProgress next = store.compute(jobId, current -> {
            if (current == null || current.status().isTerminal()) {
                return current;
            }
            int effective = Math.max(current.pct(), bounded);
            return current.advance(effective, message, stageLabel, methodTag, Instant.now(clock));
        });
        if (next == null || next.status().isTerminal()) {
            LOGGER.debug("Progress ignored jobId={} pct={} (no active live entry)", jobId, pct);
            return;
        }
        try {
            jobService.updateProgress(jobId, next.pct(), next.message(), stageLabel, methodTag);
        } catch (PersistenceException e) {
            LOGGER.warn("Durable progress write failed jobId={} pct={} error={}", jobId, next.pct(), e.getMessage());
        }
    }

    public void appendStep(UUID jobId, PipelineStage stage, StepStatus status, String message, Long durationMs) {
        int pct = store.get(jobId).map(JobProgress::pct).orElse(0);
        var step = new ProcessingStep(stage.label(), status, pct, message, Instant.now(clock), durationMs);
        try {
            jobService.appendStep(jobId, step);
        } catch (PersistenceException e) {
            LOGGER.warn("Step log append failed jobId={} stage={} status={} error={}", jobId, stage.label(), status, e.getMessage());
        }
    }

    /**
     * Live entry first, durable row as fallback.
     */
    public Optional<JobStatusView> read(UUID jobId) {
        Optional<JobProgress> live = store.get(jobId);
        if (live.isPresent()) {
            return live.map(JobStatusView::of);
        }
        return jobService.findById(jobId).map(JobStatusView::of);
    }

    public void complete(UUID jobId, String resultsReference, ProcessingMethod method) {
        String message = "Complete!";
        jobService.markCompleted(jobId, resultsReference, method.tag(), message);
        store.put(new JobProgress(jobId, JobStatus.COMPLETED, 100, message, PipelineStage.DONE.label(),
                method.tag(), resultsReference, null, Instant.now(clock)));
        scheduleEviction(jobId);
    }

    /**
     * Records the job as failed. When the durable write itself fails the live entry keeps the error visible
     * and is not evicted.
     */
    public void fail(UUID jobId, String errorMessage) {
        boolean durable = true;
        try {
            jobService.markError(jobId, errorMessage);
        } catch (PersistenceException e) {
            durable = false;
            LOGGER.error("JOB ERROR NOT PERSISTED jobId={} error={} cause={}", jobId, errorMessage, e.getMessage());
        }
        store.compute(jobId, current -> new JobProgress(jobId, JobStatus.ERROR,
                current == null ? 0 : current.pct(), "Failed", PipelineStage.FAILED.label(),
                current == null ? null : current.processingMethod(), null, errorMessage, Instant.now(clock)));
        if (durable) {
            scheduleEviction(jobId);
        }
    }

    public ProgressListener listenerFor(UUID jobId, ProcessingMethod method) {
        return new JobProgressListener(jobId, method);
    }

    private void scheduleEviction(UUID jobId) {
        Duration grace = workerProperties.getProgressGracePeriod();
        try {
            scheduler.schedule(() -> {
                store.remove(jobId);
                LOGGER.debug("Live progress evicted jobId={}", jobId);
            }, Instant.now(clock).plus(grace));
        } catch (TaskRejectedException e) {
            // durable row is already terminal; drop the live entry now
            store.remove(jobId);
            LOGGER.warn("Live progress eviction not scheduled, evicted now jobId={} error={}", jobId, e.getMessage());
        }
    }

    private final class JobProgressListener implements ProgressListener {
        private final UUID jobId;
        private final ProcessingMethod method;
        private final Map<PipelineStage, Instant> startedAt = new EnumMap<>(PipelineStage.class);

        private JobProgressListener(UUID jobId, ProcessingMethod method) {
            this.jobId = jobId;
            this.method = method;
        }

        @Override
        public void progress(int pct, String message, PipelineStage stage) {
            update(jobId, pct, message, stage, method);
        }

        @Override
        public void stageStarted(PipelineStage stage, String message) {
            startedAt.put(stage, Instant.now(clock));
            appendStep(jobId, stage, StepStatus.IN_PROGRESS, message, null);
        }

        @Override
        public void stageCompleted(PipelineStage stage, String message) {
            appendStep(jobId, stage, StepStatus.COMPLETED, message, elapsed(stage));
        }

        @Override
        public void stageFailed(PipelineStage stage, String message) {
            appendStep(jobId, stage, StepStatus.ERROR, message, elapsed(stage));
        }

        @Override
        public void stageSkipped(PipelineStage stage, String message) {
            appendStep(jobId, stage, StepStatus.COMPLETED, "Skipped: " + message, 0L);
        }

        private Long elapsed(PipelineStage stage) {
            Instant started = startedAt.remove(stage);
            return started == null ? null : Duration.between(started, Instant.now(clock)).toMillis();
        }
    }
}
