package com.example.transcribe_backend.exception;

public class StorageException extends TranscribeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
