package com.example.transcribe_backend.service.progress;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

@Component
public class InMemoryProgressStore implements ProgressStore {
    private final ConcurrentMap<UUID, JobProgress> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<JobProgress> get(UUID jobId) {
        return Optional.ofNullable(entries.get(jobId));
    }

    @Override
    public void put(JobProgress progress) {
        entries.put(progress.jobId(), progress);
    }

    @Override
    public JobProgress compute(UUID jobId, UnaryOperator<JobProgress> fn) {
        return entries.compute(jobId, (id, current) -> fn.apply(current));
    }

    @Override
    public void remove(UUID jobId) {
        entries.remove(jobId);
    }

    @Override
    public int size() {
        return entries.size();
    }
}
