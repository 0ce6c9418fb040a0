package com.example.transcribe_backend.service.download;

import com.example.transcribe_backend.config.DownloaderProperties;
import com.example.transcribe_backend.exception.AcquisitionException;
import com.example.transcribe_backend.service.process.ProcessResult;
import com.example.transcribe_backend.service.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns a source reference into a local audio file by walking an ordered list of yt-dlp strategies.
 * The first strategy that leaves a non-empty {@code <base>.<ext>} file behind wins.
 */
@Service
public class AudioDownloadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AudioDownloadService.class);
    private static final List<String> AUDIO_EXTENSIONS = List.of(".mp3", ".m4a", ".webm", ".opus", ".wav");
    static final String UNKNOWN_TITLE = "Unknown Title";

    private final DownloaderProperties props;
    private final ProcessRunner processRunner;
    private final List<DownloadStrategy> strategies;

    public AudioDownloadService(DownloaderProperties props, ProcessRunner processRunner) {
        this.props = props;
        this.processRunner = processRunner;
        this.strategies = props.getStrategies().stream().map(DownloadStrategy::from).toList();
        if (strategies.isEmpty()) {
            throw new IllegalStateException("downloader.strategies must not be empty");
        }
        LOGGER.info("AudioDownloadService strategies={}", strategies.stream().map(DownloadStrategy::name).toList());
    }

    public List<DownloadStrategy> strategies() {
        return strategies;
    }

    /**
     * @param sourceReference remote video reference, e.g. a YouTube URL.
     * @param outputDir       job-scoped directory receiving the audio file.
     * @throws AcquisitionException when every strategy was skipped or failed.
     */
    public DownloadResult download(String sourceReference, Path outputDir) {
        if (sourceReference == null || sourceReference.isBlank()) {
            throw new AcquisitionException("Source reference is blank", null, null);
        }
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new AcquisitionException("Cannot create output directory " + outputDir, null, e);
        }

        Path base = outputDir.resolve("audio_" + System.currentTimeMillis());
        Optional<String> credentials = credentialContent();
        List<DownloadAttempt> attempts = new ArrayList<>();
        CredentialFile credentialFile = null;
        String lastStrategy = null;
        String lastError = "no strategy was attempted";
        Exception lastCause = null;

        try {
            for (DownloadStrategy strategy : strategies) {
                if (strategy.requiresAuth() && credentials.isEmpty()) {
                    LOGGER.info("DOWNLOAD SKIP strategy={} reason=no-credentials", strategy.name());
                    attempts.add(DownloadAttempt.skipped(strategy.name(), "no credential material"));
                    continue;
                }
                lastStrategy = strategy.name();
                try {
                    if (strategy.requiresAuth() && credentialFile == null) {
                        credentialFile = CredentialFile.write(outputDir, credentials.get());
                    }
                    Path cookies = strategy.requiresAuth() ? credentialFile.path() : null;
                    LOGGER.info("DOWNLOAD TRY strategy={} ({}) source={}", strategy.name(), strategy.description(), sourceReference);

                    Optional<Path> audio = attempt(strategy, sourceReference, base, cookies);
                    if (audio.isPresent()) {
                        attempts.add(DownloadAttempt.succeeded(strategy.name(), audio.get().getFileName().toString()));
                        LOGGER.info("DOWNLOAD OK strategy={} file={}", strategy.name(), audio.get());
                        Metadata meta = fetchMetadata(sourceReference, cookies);
                        return new DownloadResult(audio.get(), meta.title(), meta.durationSeconds(), strategy.name(), attempts);
                    }
                    lastError = "no audio file produced";
                    lastCause = null;
                } catch (StrategyFailure e) {
                    lastError = e.getMessage();
                    lastCause = null;
                } catch (IOException | RuntimeException e) {
                    lastError = e.toString();
                    lastCause = e;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    attempts.add(DownloadAttempt.failed(strategy.name(), "interrupted"));
                    throw new AcquisitionException("Download interrupted during " + strategy.name(), strategy.name(), e);
                }
                LOGGER.warn("DOWNLOAD FAIL strategy={} error={}", strategy.name(), lastError);
                attempts.add(DownloadAttempt.failed(strategy.name(), lastError));
                cleanupPartials(outputDir, base);
            }
        } finally {
            if (credentialFile != null) {
                credentialFile.close();
            }
        }

        LOGGER.error("DOWNLOAD EXHAUSTED source={} attempts={}", sourceReference, attempts);
        throw new AcquisitionException(
                "All download methods failed. Last error: " + (lastStrategy == null ? lastError : lastStrategy + ": " + lastError),
                lastStrategy, lastCause);
    }

    /**
     * Runs {@code yt-dlp --version}.
     */
    public boolean isAvailable() {
        try {
            return runProcess(YtDlpCommand.of(props.getYtdlpBin()).buildVersion(), Duration.ofSeconds(10)).succeeded();
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Optional<Path> attempt(DownloadStrategy strategy, String sourceReference, Path base, Path cookies)
            throws IOException, InterruptedException {
        List<String> cmd = YtDlpCommand.of(props.getYtdlpBin())
                .url(sourceReference)
                .format(strategy.format())
                .output(base)
                .cookies(cookies)
                .clientProfile(strategy.clientProfile())
                .retries(strategy.retries())
                .socketTimeoutSeconds(props.getSocketTimeoutSeconds())
                .buildDownload();

        ProcessResult result = runProcess(cmd, strategy.timeout());
        if (result.timedOut()) {
            throw new StrategyFailure("yt-dlp timeout after " + strategy.timeout().toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            String output = result.diagnostics();
            if (isAuthWall(output)) {
                throw new StrategyFailure("upstream requires authentication/cookies exit=" + result.exitCode() + " log=" + output);
            }
            throw new StrategyFailure("yt-dlp exit=" + result.exitCode() + " log=" + output);
        }
        return findDownloadedFile(base);
    }

    Optional<Path> findDownloadedFile(Path base) throws IOException {
        Path dir = base.getParent();
        String prefix = base.getFileName().toString() + ".";
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().startsWith(prefix))
                    .filter(p -> hasAudioExtension(p.getFileName().toString()))
                    .filter(AudioDownloadService::nonEmpty)
                    .findFirst();
        }
    }

    private Metadata fetchMetadata(String sourceReference, Path cookies) {
        List<String> cmd = YtDlpCommand.of(props.getYtdlpBin())
                .url(sourceReference)
                .cookies(cookies)
                .socketTimeoutSeconds(props.getSocketTimeoutSeconds())
                .buildMetadata();
        try {
            ProcessResult result = runProcess(cmd, Duration.ofSeconds(props.getMetadataTimeoutSeconds()));
            if (!result.succeeded()) {
                LOGGER.warn("Metadata lookup failed exit={} timedOut={} log={}", result.exitCode(), result.timedOut(), result.diagnostics());
                return Metadata.UNKNOWN;
            }
            return Metadata.parse(result.stdout());
        } catch (IOException e) {
            LOGGER.warn("Metadata lookup failed source={} error={}", sourceReference, e.toString());
            return Metadata.UNKNOWN;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Metadata.UNKNOWN;
        }
    }

    private Optional<String> credentialContent() {
        String inline = props.getCookiesContent();
        if (inline != null && !inline.isBlank()) {
            return Optional.of(inline);
        }
        String file = props.getCookiesFile();
        if (file == null || file.isBlank()) {
            return Optional.empty();
        }
        Path cookiesPath = Path.of(file).toAbsolutePath();
        if (!Files.isReadable(cookiesPath)) {
            LOGGER.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
            return Optional.empty();
        }
        try {
            String content = Files.readString(cookiesPath, StandardCharsets.UTF_8);
            return content.isBlank() ? Optional.empty() : Optional.of(content);
        } catch (IOException e) {
            LOGGER.warn("yt-dlp cookies file unreadable path={} error={}", cookiesPath, e.toString());
            return Optional.empty();
        }
    }

    private void cleanupPartials(Path dir, Path base) {
        String prefix = base.getFileName().toString() + ".";
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().startsWith(prefix))
                    .forEach(p -> {
                        try {
                            Files.deleteIfExists(p);
                        } catch (IOException e) {
                            LOGGER.warn("Failed to delete partial download file={}", p, e);
                        }
                    });
        } catch (IOException e) {
            LOGGER.warn("Failed to list download dir={} error={}", dir, e.toString());
        }
    }

    protected ProcessResult runProcess(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        return processRunner.run(cmd, timeout);
    }

    static boolean isAuthWall(String output) {
        if (output == null) {
            return false;
        }
        String normalized = output.toLowerCase(Locale.ROOT).replace('’', '\'');
        return normalized.contains("sign in to confirm you're not a bot")
                || normalized.contains("--cookies-from-browser")
                || normalized.contains("use --cookies");
    }

    private static boolean hasAudioExtension(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return AUDIO_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static boolean nonEmpty(Path p) {
        try {
            return Files.isRegularFile(p) && Files.size(p) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private static final class StrategyFailure extends RuntimeException {
        StrategyFailure(String message) {
            super(message);
        }
    }

    record Metadata(String title, int durationSeconds) {
        static final Metadata UNKNOWN = new Metadata(UNKNOWN_TITLE, 0);

        static Metadata parse(String stdout) {
            if (stdout == null || stdout.isBlank()) {
                return UNKNOWN;
            }
            String line = stdout.strip().lines().findFirst().orElse("");
            int sep = line.lastIndexOf('|');
            String title = sep >= 0 ? line.substring(0, sep).strip() : line.strip();
            int duration = 0;
            if (sep >= 0) {
                try {
                    duration = (int) Math.round(Double.parseDouble(line.substring(sep + 1).strip()));
                } catch (NumberFormatException ignored) {
                    // "NA" for live streams
                }
            }
            return new Metadata(title.isEmpty() || "NA".equals(title) ? UNKNOWN_TITLE : title, Math.max(0, duration));
        }
    }
}
