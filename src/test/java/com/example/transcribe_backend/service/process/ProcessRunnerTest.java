package com.example.transcribe_backend.service.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    @TempDir
    private Path tempDir;

    private final ProcessRunner runner = new ProcessRunner();

    @Test
    void collectsStdoutStderrAndExitCode() throws Exception {
        ProcessResult result = runner.run(List.of("sh", "-c", "echo hello; echo oops 1>&2; exit 3"), Duration.ofSeconds(10));

        assertEquals(3, result.exitCode());
        assertEquals("hello", result.stdout());
        assertEquals("oops", result.stderr());
        assertFalse(result.timedOut());
    }

    @Test
    void timeoutReturnsPromptlyWhenChildrenHoldThePipes() {
        ProcessResult result = assertTimeoutPreemptively(Duration.ofSeconds(15),
                () -> runner.run(List.of("sh", "-c", "sleep 40 & sleep 40"), Duration.ofSeconds(1)));

        assertTrue(result.timedOut());
        assertEquals(-1, result.exitCode());
    }

    @Test
    void timeoutKillsSpawnedChildrenInsteadOfWaitingOnTheirPipes() {
        // with the children still holding stdout the readers would only give up after their own bound
        ProcessResult result = assertTimeoutPreemptively(Duration.ofSeconds(4),
                () -> runner.run(List.of("sh", "-c", "sleep 40 | cat"), Duration.ofSeconds(1)));

        assertTrue(result.timedOut());
    }

    @Test
    void interruptedCallerKillsTheProcess() throws Exception {
        Path pidFile = tempDir.resolve("self.pid");
        String script = "echo $$ > '" + pidFile + "'; exec sleep 40";
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                runner.run(List.of("sh", "-c", script), Duration.ofSeconds(60));
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        caller.start();
        long deadline = System.currentTimeMillis() + 10_000;
        while ((!Files.exists(pidFile) || Files.readString(pidFile).isBlank()) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        long pid = Long.parseLong(Files.readString(pidFile).strip());

        caller.interrupt();
        caller.join(10_000);

        assertFalse(caller.isAlive());
        assertInstanceOf(InterruptedException.class, thrown.get());
        assertFalse(awaitAlive(pid, false), "process should have been killed");
    }

    /** Polls until the process liveness equals {@code expected} or five seconds pass; returns the last observation. */
    private static boolean awaitAlive(long pid, boolean expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        boolean alive = ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        while (alive != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            alive = ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        }
        return alive;
    }
}
