package com.example.transcribe_backend.engine;

import com.example.transcribe_backend.config.PipelineProperties;
import com.example.transcribe_backend.engine.Interfaces.VocalSeparationEngine;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.service.process.ProcessResult;
import com.example.transcribe_backend.service.process.ProcessRunner;
import com.example.transcribe_backend.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Two-stem Demucs separation on CPU. The memory-safe profile processes short segments without shift averaging.
 */
@Service
public class DemucsVocalSeparationEngine implements VocalSeparationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(DemucsVocalSeparationEngine.class);

    private final PipelineProperties.Separation props;
    private final ProcessRunner processRunner;
    private volatile Boolean available;

    public DemucsVocalSeparationEngine(PipelineProperties pipeline, ProcessRunner processRunner) {
        this.props = pipeline.getSeparation();
        this.processRunner = processRunner;
    }

    @Override
    public boolean isAvailable() {
        if (!props.isEnabled()) {
            return false;
        }
        Boolean cached = available;
        if (cached == null) {
            cached = checkAvailable();
            available = cached;
        }
        return cached;
    }

    private boolean checkAvailable() {
        try {
            boolean ok = runProcess(List.of(props.getBin(), "--help"), Duration.ofSeconds(30)).succeeded();
            LOGGER.info("Demucs availability bin={} available={}", props.getBin(), ok);
            return ok;
        } catch (IOException e) {
            LOGGER.info("Demucs not available bin={} error={}", props.getBin(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public Path separate(Path audio, Path outputDir) {
        String stage = PipelineStage.VOCAL_ISOLATION.label();
        if (!Files.isRegularFile(audio)) {
            throw new ProcessingException(stage, "Input audio not found: " + audio);
        }
        List<String> cmd = new ArrayList<>(List.of(
                props.getBin(),
                "-n", props.getModel(),
                "--two-stems=vocals",
                "--mp3",
                "--device=cpu",
                "-o", outputDir.toString()
        ));
        if (props.isMemorySafe()) {
            cmd.addAll(List.of("--segment", String.valueOf(props.getSegmentSeconds()), "--overlap", "0.1", "--shifts", "0"));
        }
        cmd.add(audio.toString());

        ProcessResult result;
        try {
            Files.createDirectories(outputDir);
            result = runProcess(cmd, Duration.ofMinutes(props.getTimeoutMinutes()));
        } catch (IOException e) {
            throw new ProcessingException(stage, "Demucs could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessingException(stage, "Demucs interrupted", e);
        }
        if (result.timedOut()) {
            throw new ProcessingException(stage, "Demucs timeout after " + props.getTimeoutMinutes() + "m");
        }
        if (result.exitCode() != 0) {
            throw new ProcessingException(stage, "Demucs exit=" + result.exitCode() + " log=" + result.diagnostics());
        }
        Path vocals = findVocals(outputDir, baseName(audio))
                .orElseThrow(() -> new ProcessingException(stage, "Demucs finished but vocals file not found under " + outputDir));
        LOGGER.info("Demucs OK model={} vocals={}", props.getModel(), vocals);
        return vocals;
    }

    // demucs writes <out>/<model>/<basename>/vocals.{wav,mp3}
    Optional<Path> findVocals(Path outputDir, String base) {
        try (Stream<Path> files = Files.walk(outputDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                        return name.equals("vocals.wav") || name.equals("vocals.mp3");
                    })
                    .filter(p -> p.getParent() != null && p.getParent().getFileName().toString().equals(base))
                    .findFirst();
        } catch (IOException e) {
            throw new ProcessingException(PipelineStage.VOCAL_ISOLATION.label(), "Cannot scan Demucs output: " + e.getMessage(), e);
        }
    }

    protected ProcessResult runProcess(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        return processRunner.run(cmd, timeout);
    }

    private static String baseName(Path audio) {
        String name = audio.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
