package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.WorkerProperties;
import com.example.transcribe_backend.exception.AcquisitionException;
import com.example.transcribe_backend.exception.PersistenceException;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.service.progress.ProgressTracker;
import com.example.transcribe_backend.service.tier.TierRequest;
import com.example.transcribe_backend.service.tier.TieredProcessingOrchestrator;
import com.example.transcribe_backend.service.tier.TranscriptionOutcome;
import com.example.transcribe_backend.util.JobStatus;
import com.example.transcribe_backend.util.ProcessingMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerServiceTest {

    @Mock
    private JobService jobService;
    @Mock
    private ProgressTracker progress;
    @Mock
    private TieredProcessingOrchestrator orchestrator;
    @Mock
    private WorkDirectoryService workDirs;

    @TempDir
    private Path tempDir;

    private WorkerService worker;

    @BeforeEach
    void setUp() {
        worker = new WorkerService(jobService, progress, orchestrator, workDirs, new WorkerProperties(), Clock.systemUTC());
    }

    @Test
    void successfulJobIsCompletedAndWorkDirReleased() throws IOException {
        Job job = claimed("https://youtu.be/ok");
        when(jobService.claimNextQueued()).thenReturn(Optional.of(job));
        when(workDirs.create(job.getId())).thenReturn(tempDir);
        when(orchestrator.process(any())).thenReturn(new TranscriptionOutcome(List.of(), "", "hi", "file:///r.json",
                ProcessingMethod.LOCAL, "Title", 42));

        worker.poll();

        ArgumentCaptor<TierRequest> request = ArgumentCaptor.forClass(TierRequest.class);
        verify(orchestrator).process(request.capture());
        assertEquals("https://youtu.be/ok", request.getValue().sourceReference());
        assertEquals(tempDir, request.getValue().workDir());

        InOrder order = inOrder(progress, jobService, workDirs);
        order.verify(progress).start(job.getId());
        order.verify(jobService).updateMetadata(job.getId(), "Title", 42);
        order.verify(progress).complete(job.getId(), "file:///r.json", ProcessingMethod.LOCAL);
        order.verify(workDirs).release(job.getId());
        verify(progress, never()).fail(any(), anyString());
    }

    @Test
    void failingJobIsMarkedErrorAndLoopContinues() throws IOException {
        Job first = claimed("https://youtu.be/bad");
        Job second = claimed("https://youtu.be/ok");
        when(jobService.claimNextQueued()).thenReturn(Optional.of(first), Optional.of(second));
        when(workDirs.create(any())).thenReturn(tempDir);
        when(orchestrator.process(any()))
                .thenThrow(new AcquisitionException("All download methods failed. Last error: x: y", "x", null))
                .thenReturn(new TranscriptionOutcome(List.of(), "", "hi", "file:///r.json", ProcessingMethod.LOCAL, "T", 1));

        worker.poll();
        worker.poll();

        verify(progress).fail(first.getId(), "All download methods failed. Last error: x: y");
        verify(workDirs).release(first.getId());
        verify(progress).complete(second.getId(), "file:///r.json", ProcessingMethod.LOCAL);
        assertFalse(worker.isBusy());
    }

    @Test
    void failureToRecordFailureDoesNotEscape() throws IOException {
        Job job = claimed("https://youtu.be/bad");
        when(jobService.claimNextQueued()).thenReturn(Optional.of(job));
        when(workDirs.create(any())).thenReturn(tempDir);
        when(orchestrator.process(any())).thenThrow(new IllegalStateException());
        doThrow(new PersistenceException("db down", null)).when(progress).fail(any(), anyString());

        assertDoesNotThrow(() -> worker.poll());

        verify(progress).fail(job.getId(), "IllegalStateException");
        verify(workDirs).release(job.getId());
    }

    @Test
    void claimFailureSkipsTheTick() {
        when(jobService.claimNextQueued()).thenThrow(new PersistenceException("db down", null));

        assertDoesNotThrow(() -> worker.poll());

        verify(progress, never()).start(any());
        assertFalse(worker.isBusy());
    }

    @Test
    void emptyQueueDoesNothing() {
        when(jobService.claimNextQueued()).thenReturn(Optional.empty());

        worker.poll();

        verify(progress, never()).start(any());
        verify(jobService, never()).updateMetadata(any(), anyString(), anyInt());
    }

    @Test
    void errorMessageFallsBackToExceptionType() {
        assertThat(WorkerService.errorMessage(new RuntimeException("boom"))).isEqualTo("boom");
        assertThat(WorkerService.errorMessage(new NullPointerException())).isEqualTo("NullPointerException");
    }

    private static Job claimed(String source) {
        Job job = new Job(source);
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.PROCESSING);
        return job;
    }
}
