package com.example.transcribe_backend.service.remote;

import com.example.transcribe_backend.config.RemoteTierProperties;
import com.example.transcribe_backend.exception.RemoteUnavailableException;
import com.example.transcribe_backend.model.TimedWord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Client for the remote accelerated tier: one blocking {@code POST /transcribe} plus a health check.
 */
@Component
public class RemoteTierClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteTierClient.class);

    private final WebClient client;
    private final RemoteTierProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public RemoteTierClient(@Qualifier("remoteTierWebClient") WebClient client, RemoteTierProperties props) {
        this.client = client;
        this.props = props;
    }

    /**
     * @param words            possibly empty.
     * @param resultsReference set when the remote tier stored the result itself.
     */
    public record RemoteResult(List<TimedWord> words, String srt, String plain, String resultsReference,
                               String title, int durationSeconds) {}

    public boolean isConfigured() {
        return props.isConfigured();
    }

    /**
     * @throws RemoteUnavailableException when not configured, on transport or HTTP errors, or on an {@code error} payload.
     */
    public RemoteResult transcribe(UUID jobId, String sourceReference, String modelPreference) {
        if (!isConfigured()) {
            throw new RemoteUnavailableException("Remote tier not configured (remote.base-url / remote.api-key)");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("source_reference", sourceReference);
        body.put("job_id", jobId.toString());
        body.put("model_preference", modelPreference == null || modelPreference.isBlank()
                ? props.getDefaultModel() : modelPreference);

        LOGGER.info("REMOTE SUBMIT jobId={} model={}", jobId, body.get("model_preference"));
        String raw;
        try {
            raw = client.post()
                    .uri("/transcribe")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(b -> new RemoteUnavailableException(
                                            "Remote tier error %s: %s".formatted(resp.statusCode(), errorText(b)))))
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
        } catch (RemoteUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteUnavailableException("Remote tier call failed: " + e.getMessage(), e);
        }
        return parse(raw);
    }

    public boolean isHealthy() {
        if (!isConfigured()) {
            return false;
        }
        try {
            client.get().uri("/health")
                    .retrieve()
                    .toBodilessEntity()
                    .block(Duration.ofSeconds(Math.max(1, props.getHealthTimeoutSeconds())));
            return true;
        } catch (RuntimeException e) {
            LOGGER.debug("Remote tier health check failed error={}", e.toString());
            return false;
        }
    }

    RemoteResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new RemoteUnavailableException("Empty response from remote tier");
        }
        JsonNode root;
        try {
            root = om.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new RemoteUnavailableException("Remote tier returned malformed JSON", e);
        }
        if (root.hasNonNull("error")) {
            JsonNode err = root.get("error");
            String msg = err.isTextual() ? err.asText() : err.path("message").asText(err.toString());
            throw new RemoteUnavailableException("Remote tier failed: " + msg);
        }

        List<TimedWord> words = new ArrayList<>();
        for (JsonNode w : root.path("words")) {
            String text = w.path("word").asText(w.path("text").asText(""));
            words.add(new TimedWord(text, w.path("start").asDouble(0d), w.path("end").asDouble(0d)).normalized());
        }
        String srt = root.path("srt").asText("");
        String plain = root.path("plain").asText(root.path("text").asText(""));
        String ref = firstText(root, "results_reference", "results_url");
        JsonNode meta = root.path("metadata");
        String title = meta.path("title").asText(null);
        int duration = (int) Math.round(meta.path("duration").asDouble(0d));

        if (words.isEmpty() && srt.isBlank() && plain.isBlank() && ref == null) {
            throw new RemoteUnavailableException("Remote tier returned no transcription");
        }
        return new RemoteResult(List.copyOf(words), srt, plain, ref, title, Math.max(0, duration));
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            if (node.hasNonNull(f) && !node.get(f).asText().isBlank()) {
                return node.get(f).asText();
            }
        }
        return null;
    }

    private String errorText(String body) {
        try {
            JsonNode n = om.readTree(body);
            if (n != null && n.hasNonNull("error")) {
                return n.get("error").isTextual() ? n.get("error").asText() : n.get("error").toString();
            }
        } catch (JsonProcessingException ignored) {
            // plain-text error body
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
