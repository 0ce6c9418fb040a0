package com.example.transcribe_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A transcribed word with its start and end offset in seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimedWord(String word, double start, double end) {

    /** Clamps negative offsets to zero and keeps {@code end >= start}. */
    public TimedWord normalized() {
        double s = Double.isFinite(start) ? Math.max(0d, start) : 0d;
        double e = Double.isFinite(end) ? Math.max(s, end) : s;
        return new TimedWord(word == null ? "" : word.strip(), s, e);
    }
}
