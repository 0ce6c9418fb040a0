package com.example.transcribe_backend.engine;

import com.example.transcribe_backend.config.PipelineProperties;
import com.example.transcribe_backend.engine.Interfaces.AlignmentEngine;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.model.TimedWord;
import com.example.transcribe_backend.service.process.ProcessResult;
import com.example.transcribe_backend.service.process.ProcessRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WhisperXAlignmentEngineTest {

    private final ObjectMapper om = new ObjectMapper();

    @TempDir
    private Path tempDir;

    @Test
    void parsesSegmentWordsAndSkipsUntimedTokens() throws Exception {
        WhisperXAlignmentEngine engine = new WhisperXAlignmentEngine(new PipelineProperties(), new ProcessRunner(), om);

        List<TimedWord> words = engine.parseWords(om.readTree("""
                {"segments":[
                  {"words":[{"word":"Hello","start":0.1,"end":0.4},{"word":"2024"}]},
                  {"words":[{"word":" world ","start":0.5,"end":0.9}]},
                  {"text":"no words here"}
                ]}
                """));

        assertThat(words).containsExactly(new TimedWord("Hello", 0.1, 0.4), new TimedWord("world", 0.5, 0.9));
    }

    @Test
    void missingSegmentsIsAnError() throws Exception {
        WhisperXAlignmentEngine engine = new WhisperXAlignmentEngine(new PipelineProperties(), new ProcessRunner(), om);

        ProcessingException ex = assertThrows(ProcessingException.class, () -> engine.parseWords(om.readTree("{\"text\":\"x\"}")));

        assertThat(ex.getMessage()).contains("missing segments");
    }

    @Test
    void outputWithoutTimedWordsIsAnError() throws Exception {
        WhisperXAlignmentEngine engine = new WhisperXAlignmentEngine(new PipelineProperties(), new ProcessRunner(), om);

        assertThrows(ProcessingException.class,
                () -> engine.parseWords(om.readTree("{\"segments\":[{\"words\":[{\"word\":\"42\"}]}]}")));
    }

    @Test
    void alignRunsCliAndReadsJsonNamedAfterAudio() throws IOException {
        PipelineProperties pipeline = new PipelineProperties();
        Path audio = Files.writeString(tempDir.resolve("audio_1.mp3"), "x");
        CapturingEngine engine = new CapturingEngine(pipeline, om, 0,
                "{\"segments\":[{\"words\":[{\"word\":\"hi\",\"start\":0.0,\"end\":0.3}]}]}");

        List<TimedWord> words = engine.align(new AlignmentEngine.Request(UUID.randomUUID(), audio, "hi", List.of(), 1, tempDir));

        assertThat(words).containsExactly(new TimedWord("hi", 0.0, 0.3));
        assertThat(engine.lastCmd).startsWith("whisperx", audio.toString());
        assertThat(engine.lastCmd).containsSubsequence("--output_format", "json");
        assertThat(engine.lastCmd).containsSubsequence("--align_model", "WAV2VEC2_ASR_BASE_960H");
    }

    @Test
    void nonZeroExitFailsAlignment() throws IOException {
        Path audio = Files.writeString(tempDir.resolve("audio_1.mp3"), "x");
        CapturingEngine engine = new CapturingEngine(new PipelineProperties(), om, 1, null);

        ProcessingException ex = assertThrows(ProcessingException.class,
                () -> engine.align(new AlignmentEngine.Request(UUID.randomUUID(), audio, "hi", List.of(), 1, tempDir)));

        assertThat(ex.getStage()).isEqualTo("alignment");
        assertThat(ex.getMessage()).contains("exit=1");
    }

    private static final class CapturingEngine extends WhisperXAlignmentEngine {
        private final int exitCode;
        private final String json;
        private List<String> lastCmd;

        CapturingEngine(PipelineProperties pipeline, ObjectMapper om, int exitCode, String json) {
            super(pipeline, new ProcessRunner(), om);
            this.exitCode = exitCode;
            this.json = json;
        }

        @Override
        protected ProcessResult runProcess(List<String> cmd, Duration timeout) throws IOException {
            lastCmd = cmd;
            if (json != null) {
                Path outDir = Path.of(cmd.get(cmd.indexOf("--output_dir") + 1));
                Files.writeString(outDir.resolve("audio_1.json"), json);
            }
            return new ProcessResult(exitCode, "", exitCode == 0 ? "" : "CUDA out of memory", false);
        }
    }
}
