package com.example.transcribe_backend.engine.Interfaces;

import com.example.transcribe_backend.model.TimedWord;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

public interface AlignmentEngine {
    /**
     * @param transcript      reference text from the transcription stage.
     * @param draftWords      word timestamps from the transcription stage, possibly empty.
     * @param durationSeconds audio duration, 0 when unknown.
     */
    record Request(UUID jobId, Path audio, String transcript, List<TimedWord> draftWords,
                   int durationSeconds, Path workDir) {}

    String name();

    List<TimedWord> align(Request req);
}
