package com.example.transcribe_backend.util;

public enum StepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    ERROR
}
