package com.example.transcribe_backend.util;

import java.util.Locale;

/**
 * Named stages reported to the progress bridge and the step log.
 */
public enum PipelineStage {
    QUEUED,
    DOWNLOAD,
    VOCAL_ISOLATION,
    TRANSCRIPTION,
    ALIGNMENT,
    PERSIST,
    REMOTE,
    DONE,
    FAILED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
