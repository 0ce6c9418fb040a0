package com.example.transcribe_backend.engine;

import com.example.transcribe_backend.engine.Interfaces.AlignmentEngine;
import com.example.transcribe_backend.model.TimedWord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Keeps the transcription timestamps. When the provider returned none, words are spread evenly over the audio.
 */
@Service
@ConditionalOnProperty(prefix = "pipeline.alignment", name = "engine", havingValue = "passthrough", matchIfMissing = true)
public class PassthroughAlignmentEngine implements AlignmentEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(PassthroughAlignmentEngine.class);
    private static final double DEFAULT_SYNTHETIC_WORD_SECONDS = 0.2;

    @Override
    public String name() {
        return "passthrough";
    }

    @Override
    public List<TimedWord> align(Request req) {
        List<TimedWord> draft = req.draftWords() == null ? List.of() : req.draftWords();
        if (!draft.isEmpty()) {
            return draft.stream()
                    .map(TimedWord::normalized)
                    .filter(w -> !w.word().isEmpty())
                    .sorted(Comparator.comparingDouble(TimedWord::start))
                    .toList();
        }
        List<String> tokens = req.transcript() == null ? List.of() : Arrays.stream(req.transcript().split("\\s+"))
                .filter(t -> !t.isBlank())
                .toList();
        if (tokens.isEmpty()) {
            return List.of();
        }
        double span = req.durationSeconds() > 0
                ? req.durationSeconds()
                : DEFAULT_SYNTHETIC_WORD_SECONDS * tokens.size();
        double step = span / tokens.size();
        List<TimedWord> synthetic = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            double start = round3(i * step);
            double end = round3((i + 1) * step);
            synthetic.add(new TimedWord(tokens.get(i), start, end));
        }
        LOGGER.info("Synthesized word timings jobId={} words={} span={}s", req.jobId(), synthetic.size(), span);
        return synthetic;
    }

    private static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
