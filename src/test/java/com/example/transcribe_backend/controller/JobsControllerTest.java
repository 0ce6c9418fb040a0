package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.model.ProcessingStep;
import com.example.transcribe_backend.service.JobService;
import com.example.transcribe_backend.service.progress.JobStatusView;
import com.example.transcribe_backend.service.progress.ProgressTracker;
import com.example.transcribe_backend.util.JobStatus;
import com.example.transcribe_backend.util.StepStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = JobsController.class)
@AutoConfigureMockMvc(addFilters = false)
class JobsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private JobService jobService;

    @MockitoBean
    private ProgressTracker progressTracker;

    @Test
    void enqueueReturnsCreatedWithJobId() throws Exception {
        Job job = new Job("https://www.youtube.com/watch?v=abc");
        job.setId(UUID.randomUUID());
        when(jobService.enqueue(eq("https://www.youtube.com/watch?v=abc"), isNull())).thenReturn(job);

        mockMvc.perform(post("/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceUrl\":\" https://www.youtube.com/watch?v=abc \"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value(job.getId().toString()));
    }

    @Test
    void enqueueRejectsNonHttpSource() throws Exception {
        mockMvc.perform(post("/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceUrl\":\"file:///etc/passwd\"}"))
                .andExpect(status().isBadRequest());

        verify(jobService, never()).enqueue(any(), any());
    }

    @Test
    void enqueueRejectsBlankSource() throws Exception {
        mockMvc.perform(post("/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceUrl\":\"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statusComesFromProgressTracker() throws Exception {
        UUID id = UUID.randomUUID();
        when(progressTracker.read(id)).thenReturn(Optional.of(new JobStatusView(id, JobStatus.PROCESSING, 55,
                "Transcribing audio...", "transcription", "local", null, null)));

        mockMvc.perform(get("/v1/jobs/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.pct").value(55))
                .andExpect(jsonPath("$.currentStage").value("transcription"))
                .andExpect(jsonPath("$.processingMethod").value("local"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(progressTracker.read(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/jobs/" + id))
                .andExpect(status().isNotFound());
    }

    @Test
    void completedResultRedirects() throws Exception {
        Job job = new Job("https://youtu.be/x");
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.COMPLETED);
        job.setResultsReference("file:///data/transcriptions/x/results.json");
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/v1/jobs/" + job.getId() + "/result"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "file:///data/transcriptions/x/results.json"));
    }

    @Test
    void unfinishedResultIsConflict() throws Exception {
        Job job = new Job("https://youtu.be/x");
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.PROCESSING);
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/v1/jobs/" + job.getId() + "/result"))
                .andExpect(status().isConflict());
    }

    @Test
    void stepsListsProgressLog() throws Exception {
        Job job = new Job("https://youtu.be/x");
        job.setId(UUID.randomUUID());
        job.setProgressLog(List.of(new ProcessingStep("download", StepStatus.COMPLETED, 20, "Downloaded",
                Instant.parse("2026-01-05T10:00:00Z"), 1500L)));
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/v1/jobs/" + job.getId() + "/steps"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].stage").value("download"))
                .andExpect(jsonPath("$[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$[0].durationMs").value(1500));
    }

    @Test
    void sourceUrlValidation() {
        assertThat(JobsController.isValidSourceUrl("https://youtu.be/abc")).isTrue();
        assertThat(JobsController.isValidSourceUrl("ftp://host/file")).isFalse();
        assertThat(JobsController.isValidSourceUrl("not a url")).isFalse();
        assertThat(JobsController.isValidSourceUrl("https:///nohost")).isFalse();
    }
}
