package com.example.transcribe_backend.engine;

import com.example.transcribe_backend.config.OpenAIAudioProperties;
import com.example.transcribe_backend.config.OpenAIEmbeddingProperties;
import com.example.transcribe_backend.engine.Interfaces.EmbeddingEngine;
import com.example.transcribe_backend.exception.ProcessingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Calls {@code /v1/embeddings}, sending texts in batches and reordering each answer by its {@code index}.
 */
@Service
public class OpenAIEmbeddingEngine implements EmbeddingEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAIEmbeddingEngine.class);
    static final String STAGE = "embedding";

    private final WebClient client;
    private final OpenAIAudioProperties audioProps;
    private final OpenAIEmbeddingProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public OpenAIEmbeddingEngine(@Qualifier("openAiWebClient") WebClient client,
                                 OpenAIAudioProperties audioProps,
                                 OpenAIEmbeddingProperties props) {
        this.client = client;
        this.audioProps = audioProps;
        this.props = props;
    }

    @Override
    public String model() {
        return props.getModel();
    }

    @Override
    public List<List<Double>> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        if (audioProps.getApiKey() == null || audioProps.getApiKey().isBlank()) {
            throw new ProcessingException(STAGE, "OpenAI API key not configured (openai.audio.api-key)");
        }
        int batchSize = Math.max(1, props.getBatchSize());
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(texts.size(), from + batchSize));
            vectors.addAll(embedBatch(batch));
        }
        LOGGER.info("OpenAI embeddings OK model={} texts={}", props.getModel(), texts.size());
        return vectors;
    }

    private List<List<Double>> embedBatch(List<String> batch) {
        String body;
        try {
            body = client.post()
                    .uri("/v1/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("model", props.getModel(), "input", batch))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(err -> new ProcessingException(STAGE,
                                            "OpenAI embedding error %s: %s".formatted(resp.statusCode(), truncate(err, 500)))))
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
        } catch (ProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProcessingException(STAGE, "OpenAI embedding failed: " + e.getMessage(), e);
        }
        return parse(body, batch.size());
    }

    List<List<Double>> parse(String body, int expected) {
        JsonNode root;
        try {
            root = om.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ProcessingException(STAGE, "Unreadable embedding response: " + truncate(body, 200), e);
        }
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isArray() || data.size() != expected) {
            throw new ProcessingException(STAGE, "Embedding response has %d vectors, expected %d"
                    .formatted(data == null || !data.isArray() ? 0 : data.size(), expected));
        }
        @SuppressWarnings("unchecked")
        List<Double>[] ordered = new List[expected];
        int position = 0;
        for (JsonNode item : data) {
            int index = item.path("index").asInt(position);
            JsonNode embedding = item.get("embedding");
            if (index < 0 || index >= expected || ordered[index] != null
                    || embedding == null || !embedding.isArray() || embedding.isEmpty()) {
                throw new ProcessingException(STAGE, "Malformed embedding at position " + position);
            }
            List<Double> vector = new ArrayList<>(embedding.size());
            embedding.forEach(v -> vector.add(v.asDouble()));
            ordered[index] = vector;
            position++;
        }
        return Arrays.asList(ordered);
    }

    private static String truncate(String body, int max) {
        if (body == null) return "";
        if (body.length() <= max) return body;
        return body.substring(0, max) + "...";
    }
}
