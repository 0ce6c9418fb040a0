package com.example.transcribe_backend.exception;

public class RemoteUnavailableException extends TranscribeException {
    public RemoteUnavailableException(String message) {
        super(message);
    }

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
