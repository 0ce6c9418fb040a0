package com.example.transcribe_backend.model;

import com.example.transcribe_backend.util.StepStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One entry of a job's durable step log. Entries are only ever appended.
 *
 * @param stage      stage label, e.g. {@code download}.
 * @param status     state of the stage when the entry was written.
 * @param pct        job percentage at entry time.
 * @param message    human-readable detail.
 * @param timestamp  when the entry was written.
 * @param durationMs stage duration for completed/failed entries, otherwise {@code null}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessingStep(
        String stage,
        StepStatus status,
        int pct,
        String message,
        Instant timestamp,
        Long durationMs
) {
}
