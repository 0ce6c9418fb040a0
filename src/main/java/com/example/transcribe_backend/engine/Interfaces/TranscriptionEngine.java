package com.example.transcribe_backend.engine.Interfaces;

import com.example.transcribe_backend.model.TimedWord;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

public interface TranscriptionEngine {
    record Request(UUID jobId, Path audio, String langHint) {}

    /**
     * @param words word timestamps when the provider returns them, otherwise empty.
     */
    record Result(String text, List<TimedWord> words, String provider) {}

    Result transcribe(Request req);
}
