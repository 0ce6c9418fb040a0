package com.example.transcribe_backend.service.progress;

import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Keyed table of jobs that are actively processing or just finished.
 */
public interface ProgressStore {

    Optional<JobProgress> get(UUID jobId);

    void put(JobProgress progress);

    /**
     * Atomically replaces the entry for {@code jobId}. The function receives {@code null} when absent
     * and may return {@code null} to leave the table without an entry.
     *
     * @return the entry after the update, or {@code null}.
     */
    JobProgress compute(UUID jobId, UnaryOperator<JobProgress> fn);

    void remove(UUID jobId);

    int size();
}
