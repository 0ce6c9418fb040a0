package com.example.transcribe_backend.config;

import com.example.transcribe_backend.util.CleanupPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configures the job queue poller, the live-progress grace window and working directory handling.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerProperties {

    private long pollIntervalMs = 5000;
    private Duration progressGracePeriod = Duration.ofSeconds(10);
    private Duration heartbeatInterval = Duration.ofSeconds(60);
    private String workDir = "./temp";
    private int finalWriteAttempts = 3;
    private Duration finalWriteBackoff = Duration.ofMillis(500);
    private Cleanup cleanup = new Cleanup();

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public Duration getProgressGracePeriod() {
        return progressGracePeriod;
    }

    public void setProgressGracePeriod(Duration progressGracePeriod) {
        this.progressGracePeriod = progressGracePeriod;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public int getFinalWriteAttempts() {
        return finalWriteAttempts;
    }

    public void setFinalWriteAttempts(int finalWriteAttempts) {
        this.finalWriteAttempts = finalWriteAttempts;
    }

    public Duration getFinalWriteBackoff() {
        return finalWriteBackoff;
    }

    public void setFinalWriteBackoff(Duration finalWriteBackoff) {
        this.finalWriteBackoff = finalWriteBackoff;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public void setCleanup(Cleanup cleanup) {
        this.cleanup = cleanup;
    }

    public static class Cleanup {
        private CleanupPolicy policy = CleanupPolicy.IMMEDIATE;

        public CleanupPolicy getPolicy() {
            return policy;
        }

        public void setPolicy(CleanupPolicy policy) {
            this.policy = policy;
        }
    }
}
