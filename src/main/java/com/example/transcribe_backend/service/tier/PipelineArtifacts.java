package com.example.transcribe_backend.service.tier;

import com.example.transcribe_backend.model.TimedWord;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Intermediate files and data of one local-tier run.
 */
public class PipelineArtifacts {
    private final Path workDir;
    private Path rawAudio;
    private Path vocals;
    private String transcriptText;
    private List<TimedWord> words = List.of();
    private String subtitleText;

    public PipelineArtifacts(Path workDir) {
        this.workDir = workDir;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Path getRawAudio() {
        return rawAudio;
    }

    public void setRawAudio(Path rawAudio) {
        this.rawAudio = rawAudio;
    }

    public Optional<Path> getVocals() {
        return Optional.ofNullable(vocals);
    }

    public void setVocals(Path vocals) {
        this.vocals = vocals;
    }

    /** Isolated vocals when present, otherwise the raw download. */
    public Path transcriptionInput() {
        return vocals != null ? vocals : rawAudio;
    }

    public String getTranscriptText() {
        return transcriptText;
    }

    public void setTranscriptText(String transcriptText) {
        this.transcriptText = transcriptText;
    }

    public List<TimedWord> getWords() {
        return words;
    }

    public void setWords(List<TimedWord> words) {
        this.words = words == null ? List.of() : List.copyOf(words);
    }

    public String getSubtitleText() {
        return subtitleText;
    }

    public void setSubtitleText(String subtitleText) {
        this.subtitleText = subtitleText;
    }
}
