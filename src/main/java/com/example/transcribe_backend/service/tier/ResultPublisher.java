package com.example.transcribe_backend.service.tier;

import com.example.transcribe_backend.config.StorageProperties;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.exception.StorageException;
import com.example.transcribe_backend.model.TimedWord;
import com.example.transcribe_backend.service.Interfaces.StorageService;
import com.example.transcribe_backend.util.PipelineStage;
import com.example.transcribe_backend.util.ProcessingMethod;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Uploads the result document and the SRT for a job. The result document's URI is the job's result reference.
 */
@Component
public class ResultPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultPublisher.class);

    private final StorageService storage;
    private final StorageProperties storageProperties;
    private final ObjectMapper om;
    private final Clock clock;

    public ResultPublisher(StorageService storage, StorageProperties storageProperties, ObjectMapper om, Clock clock) {
        this.storage = storage;
        this.storageProperties = storageProperties;
        this.om = om;
        this.clock = clock;
    }

    public String publish(UUID jobId, List<TimedWord> words, String srt, String plain,
                          String title, int durationSeconds, ProcessingMethod method) {
        String stage = PipelineStage.PERSIST.label();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", title);
        metadata.put("duration", durationSeconds);
        metadata.put("processedAt", Instant.now(clock).toString());
        metadata.put("processingMethod", method.tag());

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("words", words);
        doc.put("srt", srt);
        doc.put("plain", plain);
        doc.put("metadata", metadata);

        String base = storageProperties.getResultsPrefix() + "/" + jobId;
        try {
            byte[] json = om.writeValueAsBytes(doc);
            StorageService.StoredObject results = storage.upload(json, base + "/results.json", "application/json");
            storage.uploadText(srt == null ? "" : srt, base + "/subtitles.srt", "application/x-subrip");
            LOGGER.info("RESULTS STORED jobId={} key={} words={}", jobId, results.key(), words.size());
            return results.uri().toString();
        } catch (JsonProcessingException e) {
            throw new ProcessingException(stage, "Serialize result JSON failed: " + e.getMessage(), e);
        } catch (StorageException e) {
            throw new ProcessingException(stage, "Result upload failed: " + e.getMessage(), e);
        }
    }
}
