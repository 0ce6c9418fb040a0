package com.example.transcribe_backend.service.progress;

import com.example.transcribe_backend.util.PipelineStage;

/**
 * Receives a tier's progress. Percentages are job-wide, not per stage.
 */
public interface ProgressListener {

    void progress(int pct, String message, PipelineStage stage);

    void stageStarted(PipelineStage stage, String message);

    void stageCompleted(PipelineStage stage, String message);

    void stageFailed(PipelineStage stage, String message);

    void stageSkipped(PipelineStage stage, String message);

    ProgressListener NOOP = new ProgressListener() {
        @Override
        public void progress(int pct, String message, PipelineStage stage) {
        }

        @Override
        public void stageStarted(PipelineStage stage, String message) {
        }

        @Override
        public void stageCompleted(PipelineStage stage, String message) {
        }

        @Override
        public void stageFailed(PipelineStage stage, String message) {
        }

        @Override
        public void stageSkipped(PipelineStage stage, String message) {
        }
    };
}
