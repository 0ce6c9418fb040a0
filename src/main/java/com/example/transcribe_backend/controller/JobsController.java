package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.model.ProcessingStep;
import com.example.transcribe_backend.service.JobService;
import com.example.transcribe_backend.service.progress.JobStatusView;
import com.example.transcribe_backend.service.progress.ProgressTracker;
import com.example.transcribe_backend.util.JobStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/v1/jobs")
public class JobsController {
    private final JobService jobService;
    private final ProgressTracker progressTracker;

    public JobsController(JobService jobService, ProgressTracker progressTracker) {
        this.jobService = jobService;
        this.progressTracker = progressTracker;
    }

    public record EnqueueReq(
            @NotBlank @Size(max = 2048) String sourceUrl,
            @Size(max = 128) String model
    ) {
        @AssertTrue(message = "sourceUrl must be an absolute http(s) URL")
        public boolean isSourceUrlValid() {
            return sourceUrl == null || isValidSourceUrl(sourceUrl);
        }
    }
    public record EnqueueRes(UUID jobId) {}
    public record JobRes(
            UUID jobId,
            String status,
            int pct,
            String statusMessage,
            String currentStage,
            String processingMethod,
            String resultUrl,
            String error
    ) {
        static JobRes of(JobStatusView v) {
            return new JobRes(v.jobId(), v.status().name().toLowerCase(Locale.ROOT), v.pct(), v.statusMessage(),
                    v.currentStage(), v.processingMethod(), v.resultsReference(), v.errorMessage());
        }
    }

    @Operation(summary = "Queue a transcription job for a remote video")
    @ApiResponse(responseCode = "201", description = "Job queued")
    @ApiResponse(responseCode = "400", description = "Invalid request payload")
    @PostMapping
    public ResponseEntity<EnqueueRes> enqueue(@Valid @RequestBody EnqueueReq req) {
        Job job = jobService.enqueue(req.sourceUrl().strip(), req.model());
        return ResponseEntity.status(HttpStatus.CREATED).body(new EnqueueRes(job.getId()));
    }

    @Operation(summary = "Current status of a job, live progress first")
    @ApiResponse(responseCode = "404", description = "Unknown job")
    @GetMapping("/{id}")
    public JobRes get(@PathVariable UUID id) {
        return progressTracker.read(id)
                .map(JobRes::of)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    @GetMapping("/{id}/steps")
    public List<ProcessingStep> steps(@PathVariable UUID id) {
        return jobService.findById(id)
                .map(Job::getProgressLog)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    @Operation(summary = "Redirect to the stored result document")
    @ApiResponse(responseCode = "302", description = "Result available")
    @ApiResponse(responseCode = "409", description = "Job has not completed")
    @GetMapping("/{id}/result")
    public ResponseEntity<Void> result(@PathVariable UUID id) {
        Job job = jobService.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        if (job.getStatus() != JobStatus.COMPLETED || job.getResultsReference() == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "RESULT_NOT_READY");
        }
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(job.getResultsReference())).build();
    }

    static boolean isValidSourceUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.strip());
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
