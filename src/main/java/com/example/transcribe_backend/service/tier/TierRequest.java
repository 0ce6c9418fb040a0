package com.example.transcribe_backend.service.tier;

import java.nio.file.Path;
import java.util.UUID;

/**
 * @param workDir job-scoped directory owned by this job for the duration of processing.
 */
public record TierRequest(UUID jobId, String sourceReference, String modelPreference, Path workDir) {
}
