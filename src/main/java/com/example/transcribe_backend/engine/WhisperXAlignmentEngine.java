package com.example.transcribe_backend.engine;

import com.example.transcribe_backend.config.PipelineProperties;
import com.example.transcribe_backend.engine.Interfaces.AlignmentEngine;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.model.TimedWord;
import com.example.transcribe_backend.service.process.ProcessResult;
import com.example.transcribe_backend.service.process.ProcessRunner;
import com.example.transcribe_backend.util.PipelineStage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Forced alignment through the WhisperX CLI. Word timestamps come from {@code segments[].words[]} of its JSON output.
 */
@Service
@ConditionalOnProperty(prefix = "pipeline.alignment", name = "engine", havingValue = "whisperx")
public class WhisperXAlignmentEngine implements AlignmentEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(WhisperXAlignmentEngine.class);

    private final PipelineProperties.Alignment props;
    private final ProcessRunner processRunner;
    private final ObjectMapper om;

    public WhisperXAlignmentEngine(PipelineProperties pipeline, ProcessRunner processRunner, ObjectMapper om) {
        this.props = pipeline.getAlignment();
        this.processRunner = processRunner;
        this.om = om;
    }

    @Override
    public String name() {
        return "whisperx";
    }

    @Override
    public List<TimedWord> align(Request req) {
        String stage = PipelineStage.ALIGNMENT.label();
        Path outDir = req.workDir().resolve("whisperx");
        List<String> cmd = List.of(
                props.getBin(),
                req.audio().toString(),
                "--compute_type", props.getComputeType(),
                "--output_dir", outDir.toString(),
                "--output_format", "json",
                "--model", props.getModel(),
                "--align_model", props.getAlignModel(),
                "--interpolate_method", "linear",
                "--chunk_size", "30"
        );
        ProcessResult result;
        try {
            Files.createDirectories(outDir);
            result = runProcess(cmd, Duration.ofMinutes(props.getTimeoutMinutes()));
        } catch (IOException e) {
            throw new ProcessingException(stage, "WhisperX could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessingException(stage, "WhisperX interrupted", e);
        }
        if (result.timedOut()) {
            throw new ProcessingException(stage, "WhisperX timeout after " + props.getTimeoutMinutes() + "m");
        }
        if (result.exitCode() != 0) {
            throw new ProcessingException(stage, "WhisperX exit=" + result.exitCode() + " log=" + result.diagnostics());
        }

        Path json = outDir.resolve(baseName(req.audio()) + ".json");
        if (!Files.isRegularFile(json)) {
            throw new ProcessingException(stage, "WhisperX output file not found: " + json);
        }
        try {
            List<TimedWord> words = parseWords(om.readTree(json.toFile()));
            LOGGER.info("WhisperX aligned jobId={} words={}", req.jobId(), words.size());
            return words;
        } catch (IOException e) {
            throw new ProcessingException(stage, "WhisperX output unreadable: " + e.getMessage(), e);
        }
    }

    List<TimedWord> parseWords(JsonNode root) {
        String stage = PipelineStage.ALIGNMENT.label();
        JsonNode segments = root == null ? null : root.get("segments");
        if (segments == null || !segments.isArray()) {
            throw new ProcessingException(stage, "WhisperX output format not recognized - missing segments.");
        }
        List<TimedWord> words = new ArrayList<>();
        for (JsonNode segment : segments) {
            JsonNode segWords = segment.get("words");
            if (segWords == null || !segWords.isArray()) {
                continue;
            }
            for (JsonNode w : segWords) {
                String text = w.path("word").asText(w.path("text").asText("")).strip();
                // unalignable tokens (numbers, symbols) come back without timing
                if (text.isEmpty() || !w.hasNonNull("start")) {
                    continue;
                }
                double start = w.path("start").asDouble(0d);
                double end = w.path("end").asDouble(start);
                words.add(new TimedWord(text, start, end).normalized());
            }
        }
        if (words.isEmpty()) {
            throw new ProcessingException(stage, "WhisperX produced no word-level timestamps");
        }
        return words;
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
