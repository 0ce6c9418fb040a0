package com.example.transcribe_backend.engine.Interfaces;

import java.nio.file.Path;

/**
 * Extracts the vocal stem from an audio file.
 */
public interface VocalSeparationEngine {

    boolean isAvailable();

    /**
     * @return path of the isolated vocal track inside {@code outputDir}.
     */
    Path separate(Path audio, Path outputDir);
}
