package com.example.transcribe_backend.util;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
