package com.example.transcribe_backend.service.download;

/**
 * Record of one strategy's turn during a single download call.
 */
public record DownloadAttempt(String strategy, Outcome outcome, String detail) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    static DownloadAttempt succeeded(String strategy, String detail) {
        return new DownloadAttempt(strategy, Outcome.SUCCEEDED, detail);
    }

    static DownloadAttempt failed(String strategy, String detail) {
        return new DownloadAttempt(strategy, Outcome.FAILED, detail);
    }

    static DownloadAttempt skipped(String strategy, String detail) {
        return new DownloadAttempt(strategy, Outcome.SKIPPED, detail);
    }

    @Override
    public String toString() {
        return strategy + "=" + outcome + (detail == null ? "" : "(" + detail + ")");
    }
}
