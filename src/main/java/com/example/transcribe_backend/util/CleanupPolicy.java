package com.example.transcribe_backend.util;

/**
 * When per-job working directories are removed.
 */
public enum CleanupPolicy {
    /** Right after the job reaches a terminal state. */
    IMMEDIATE,
    /** Only in bulk when the application shuts down. */
    ON_SHUTDOWN
}
