package com.example.transcribe_backend.service.tier;

import com.example.transcribe_backend.model.TimedWord;
import com.example.transcribe_backend.util.ProcessingMethod;

import java.util.List;

/**
 * Normalized result of whichever tier succeeded.
 */
public record TranscriptionOutcome(
        List<TimedWord> words,
        String srt,
        String plain,
        String resultsReference,
        ProcessingMethod processingMethod,
        String title,
        int durationSeconds
) {
    public TranscriptionOutcome {
        words = words == null ? List.of() : List.copyOf(words);
        if (resultsReference == null || resultsReference.isBlank()) {
            throw new IllegalArgumentException("resultsReference is required");
        }
    }
}
