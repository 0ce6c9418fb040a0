package com.example.transcribe_backend.exception;

/**
 * Durable job store read or write failed.
 */
public class PersistenceException extends TranscribeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
