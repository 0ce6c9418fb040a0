package com.example.transcribe_backend.util;

import java.util.Locale;

/**
 * Which tier produced a job's result. Stored lowercase on the job row.
 */
public enum ProcessingMethod {
    LOCAL,
    REMOTE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
