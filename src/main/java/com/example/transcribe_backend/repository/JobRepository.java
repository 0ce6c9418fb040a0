package com.example.transcribe_backend.repository;

import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.util.JobStatus;
import jakarta.transaction.Transactional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface JobRepository extends JpaRepository<Job, UUID> {
    long countByStatus(JobStatus status);

    Optional<Job> findFirstByStatusOrderByCreatedAtAsc(JobStatus status);

    /**
     * Conditional claim: only a row that is still QUEUED moves to PROCESSING.
     *
     * @return number of rows claimed (0 or 1).
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.status = com.example.transcribe_backend.util.JobStatus.PROCESSING,
               j.statusMessage = :message,
               j.currentStage = :stage,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.transcribe_backend.util.JobStatus.QUEUED
        """)
    int markProcessing(@Param("id") UUID id,
                       @Param("message") String message,
                       @Param("stage") String stage,
                       @Param("now") Instant now);

    /**
     * Writes live progress through to the row. Never lowers pct and never touches a terminal row.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.pct = :pct,
               j.statusMessage = :message,
               j.currentStage = coalesce(:stage, j.currentStage),
               j.processingMethod = coalesce(:method, j.processingMethod),
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.transcribe_backend.util.JobStatus.PROCESSING
           and j.pct <= :pct
        """)
    int updateProgress(@Param("id") UUID id,
                       @Param("pct") int pct,
                       @Param("message") String message,
                       @Param("stage") String stage,
                       @Param("method") String method,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.status = com.example.transcribe_backend.util.JobStatus.COMPLETED,
               j.pct = 100,
               j.statusMessage = :message,
               j.currentStage = 'done',
               j.processingMethod = :method,
               j.resultsReference = :resultsReference,
               j.errorMessage = null,
               j.completedAt = :now,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
        """)
    int markCompleted(@Param("id") UUID id,
                      @Param("resultsReference") String resultsReference,
                      @Param("method") String method,
                      @Param("message") String message,
                      @Param("now") Instant now);

    /**
     * Fails a claimed job. A row that already reached a terminal state is left as it is.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.status = com.example.transcribe_backend.util.JobStatus.ERROR,
               j.statusMessage = 'Failed',
               j.currentStage = 'failed',
               j.errorMessage = :errorMessage,
               j.resultsReference = null,
               j.completedAt = :now,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.transcribe_backend.util.JobStatus.PROCESSING
        """)
    int markError(@Param("id") UUID id,
                  @Param("errorMessage") String errorMessage,
                  @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.title = :title,
               j.durationSeconds = :durationSeconds,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
        """)
    int updateMetadata(@Param("id") UUID id,
                       @Param("title") String title,
                       @Param("durationSeconds") Integer durationSeconds,
                       @Param("now") Instant now);
}
