package com.example.transcribe_backend.exception;

/**
 * Root of the pipeline's unchecked exception hierarchy.
 */
public class TranscribeException extends RuntimeException {
    public TranscribeException(String message) {
        super(message);
    }

    public TranscribeException(String message, Throwable cause) {
        super(message, cause);
    }
}
