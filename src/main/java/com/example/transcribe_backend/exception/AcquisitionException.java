package com.example.transcribe_backend.exception;

/**
 * Every download strategy was skipped or failed for a source reference.
 */
public class AcquisitionException extends TranscribeException {
    private final String lastStrategy;

    public AcquisitionException(String message, String lastStrategy, Throwable cause) {
        super(message, cause);
        this.lastStrategy = lastStrategy;
    }

    public String getLastStrategy() {
        return lastStrategy;
    }
}
