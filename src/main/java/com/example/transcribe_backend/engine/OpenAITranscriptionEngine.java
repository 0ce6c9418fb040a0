package com.example.transcribe_backend.engine;

import com.example.transcribe_backend.config.OpenAIAudioProperties;
import com.example.transcribe_backend.engine.Interfaces.TranscriptionEngine;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.model.TimedWord;
import com.example.transcribe_backend.util.PipelineStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Calls the OpenAI-compatible {@code /v1/audio/transcriptions} endpoint.
 * Word timestamps are requested only from models that support {@code verbose_json}.
 */
@Service
public class OpenAITranscriptionEngine implements TranscriptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAITranscriptionEngine.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    private static final int RETRY_MAX_ATTEMPTS = 2;

    private final WebClient client;
    private final OpenAIAudioProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public OpenAITranscriptionEngine(@Qualifier("openAiWebClient") WebClient client, OpenAIAudioProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Result transcribe(Request request) {
        String stage = PipelineStage.TRANSCRIPTION.label();
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new ProcessingException(stage, "OpenAI API key not configured (openai.audio.api-key)");
        }
        if (request.audio() == null || !Files.isRegularFile(request.audio())) {
            throw new ProcessingException(stage, "Input audio not found: " + request.audio());
        }

        boolean wordTimestamps = props.supportsWordTimestamps();
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new FileSystemResource(request.audio()));
        form.add("model", props.getModel());
        String langHint = request.langHint() != null && !request.langHint().isBlank()
                ? request.langHint()
                : props.getLanguage();
        if (langHint != null && !langHint.isBlank()) {
            form.add("language", langHint.toLowerCase(Locale.ROOT));
        }
        if (wordTimestamps) {
            form.add("response_format", "verbose_json");
            form.add("timestamp_granularities[]", "word");
        } else {
            form.add("response_format", "json");
        }
        LOGGER.info("OpenAI transcription request jobId={} model={} wordTimestamps={}", request.jobId(), props.getModel(), wordTimestamps);

        Mono<JsonNode> mono = client.post()
                .uri("/v1/audio/transcriptions")
                .body(BodyInserters.fromMultipartData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new ProcessingException(stage,
                                        "OpenAI transcription error %s: %s".formatted(resp.statusCode(), truncate(body, 500)))))
                .bodyToMono(String.class)
                .map(this::parseJson)
                .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("OpenAI transcription retry attempt={} jobId={} type={}",
                                signal.totalRetriesInARow() + 1, request.jobId(),
                                signal.failure() == null ? "unknown" : signal.failure().getClass().getSimpleName()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));

        JsonNode root;
        try {
            root = mono.block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
        } catch (ProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProcessingException(stage, "OpenAI transcription failed: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new ProcessingException(stage, "Empty response from OpenAI transcription");
        }

        String text = root.path("text").asText("").strip();
        List<TimedWord> words = new ArrayList<>();
        if (root.has("words") && root.get("words").isArray()) {
            for (JsonNode w : root.get("words")) {
                words.add(parseWord(w));
            }
        } else if (root.has("segments") && root.get("segments").isArray()) {
            for (JsonNode seg : root.get("segments")) {
                if (seg.has("words")) {
                    for (JsonNode w : seg.get("words")) {
                        words.add(parseWord(w));
                    }
                }
            }
        }
        words = words.stream()
                .map(TimedWord::normalized)
                .filter(w -> !w.word().isEmpty())
                .sorted(Comparator.comparingDouble(TimedWord::start))
                .toList();

        if (text.isEmpty() && words.isEmpty()) {
            throw new ProcessingException(stage, "OpenAI transcription returned no text");
        }
        LOGGER.info("OpenAI transcription OK jobId={} chars={} words={}", request.jobId(), text.length(), words.size());
        return new Result(text, words, "openai");
    }

    private TimedWord parseWord(JsonNode w) {
        double s = w.path("start").asDouble(Double.NaN);
        double e = w.path("end").asDouble(Double.NaN);
        String text = w.path("word").asText(w.path("text").asText(""));
        return new TimedWord(text, Double.isFinite(s) ? s : 0d, Double.isFinite(e) ? e : (Double.isFinite(s) ? s : 0d));
    }

    private JsonNode parseJson(String body) {
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            int length = body == null ? 0 : body.length();
            throw new TruncatedResponseException("OPENAI_TRUNCATED_RESPONSE length=" + length + " snippet=" + truncate(body, 500), e);
        }
    }

    private boolean isRetryable(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof PrematureCloseException || cursor instanceof TruncatedResponseException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    private static String truncate(String body, int max) {
        if (body == null) return "";
        if (body.length() <= max) return body;
        return body.substring(0, max) + "...";
    }

    private static class TruncatedResponseException extends RuntimeException {
        TruncatedResponseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
