package com.example.transcribe_backend.service.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool to completion, collecting stdout and stderr separately.
 * A process still running after the timeout is killed and reported as timed out.
 */
@Component
public class ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);
    private static final long READER_JOIN_MILLIS = 5_000;
    private static final long KILL_WAIT_SECONDS = 5;

    public ProcessResult run(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        return run(cmd, timeout, null);
    }

    public ProcessResult run(List<String> cmd, Duration timeout, Path workingDir) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(cmd);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        LOGGER.debug("PROCESS START bin={} args={}", cmd.get(0), cmd.size() - 1);
        Process p = pb.start();
        StringJoiner out = new StringJoiner(System.lineSeparator());
        StringJoiner err = new StringJoiner(System.lineSeparator());
        Thread outReader = drain(p.getInputStream(), out, "proc-out");
        Thread errReader = drain(p.getErrorStream(), err, "proc-err");

        boolean finished = false;
        try {
            finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOGGER.warn("PROCESS TIMEOUT bin={} after={}s", cmd.get(0), timeout.toSeconds());
            }
        } finally {
            if (!finished) {
                killTree(p);
            }
        }
        // a surviving grandchild can hold the pipes open past the kill
        long joinDeadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(READER_JOIN_MILLIS);
        joinUntil(outReader, joinDeadline);
        joinUntil(errReader, joinDeadline);
        int code = finished ? p.exitValue() : -1;
        String stdout;
        String stderr;
        synchronized (out) {
            stdout = out.toString();
        }
        synchronized (err) {
            stderr = err.toString();
        }
        return new ProcessResult(code, stdout, stderr, !finished);
    }

    /**
     * Kills the process and everything it spawned. yt-dlp hands extraction to ffmpeg, which inherits the pipes.
     */
    static void killTree(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            p.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void joinUntil(Thread reader, long deadlineNanos) throws InterruptedException {
        long remaining = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        if (remaining > 0) {
            reader.join(remaining);
        }
    }

    private Thread drain(InputStream stream, StringJoiner sink, String name) {
        Thread reader = new Thread(() -> {
            try (var buffered = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    synchronized (sink) {
                        sink.add(line);
                    }
                }
            } catch (IOException ignored) {
                // exit code and timeout decide the outcome; partial output is enough
            }
        }, name);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }
}
