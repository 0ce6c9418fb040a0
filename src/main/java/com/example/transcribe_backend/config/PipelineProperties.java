package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local tier tooling: vocal separation (Demucs) and forced alignment (WhisperX).
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Separation separation = new Separation();
    private Alignment alignment = new Alignment();

    public Separation getSeparation() {
        return separation;
    }

    public void setSeparation(Separation separation) {
        this.separation = separation;
    }

    public Alignment getAlignment() {
        return alignment;
    }

    public void setAlignment(Alignment alignment) {
        this.alignment = alignment;
    }

    public static class Separation {
        private boolean enabled = true;
        private String bin = "demucs";
        private String model = "htdemucs";
        /** Memory-constrained profile: chunked processing and the duration cap below. */
        private boolean memorySafe = true;
        private int segmentSeconds = 15;
        private long maxDurationSeconds = 600;
        private long timeoutMinutes = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBin() {
            return bin;
        }

        public void setBin(String bin) {
            this.bin = bin;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean isMemorySafe() {
            return memorySafe;
        }

        public void setMemorySafe(boolean memorySafe) {
            this.memorySafe = memorySafe;
        }

        public int getSegmentSeconds() {
            return segmentSeconds;
        }

        public void setSegmentSeconds(int segmentSeconds) {
            this.segmentSeconds = segmentSeconds;
        }

        public long getMaxDurationSeconds() {
            return maxDurationSeconds;
        }

        public void setMaxDurationSeconds(long maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
        }

        public long getTimeoutMinutes() {
            return timeoutMinutes;
        }

        public void setTimeoutMinutes(long timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
        }
    }

    public static class Alignment {
        public enum Engine { PASSTHROUGH, WHISPERX }

        private Engine engine = Engine.PASSTHROUGH;
        private String bin = "whisperx";
        private String model = "base";
        private String alignModel = "WAV2VEC2_ASR_BASE_960H";
        private String computeType = "float16";
        private long timeoutMinutes = 30;

        public Engine getEngine() {
            return engine;
        }

        public void setEngine(Engine engine) {
            this.engine = engine;
        }

        public String getBin() {
            return bin;
        }

        public void setBin(String bin) {
            this.bin = bin;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getAlignModel() {
            return alignModel;
        }

        public void setAlignModel(String alignModel) {
            this.alignModel = alignModel;
        }

        public String getComputeType() {
            return computeType;
        }

        public void setComputeType(String computeType) {
            this.computeType = computeType;
        }

        public long getTimeoutMinutes() {
            return timeoutMinutes;
        }

        public void setTimeoutMinutes(long timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
        }
    }
}
