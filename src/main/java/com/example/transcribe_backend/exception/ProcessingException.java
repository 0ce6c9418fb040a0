package com.example.transcribe_backend.exception;

/**
 * A pipeline stage (isolation, transcription, alignment, result persistence) failed within a tier.
 */
public class ProcessingException extends TranscribeException {
    private final String stage;

    public ProcessingException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public ProcessingException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
