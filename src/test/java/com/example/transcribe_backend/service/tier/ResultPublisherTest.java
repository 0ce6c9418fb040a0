package com.example.transcribe_backend.service.tier;

import com.example.transcribe_backend.config.StorageProperties;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.model.TimedWord;
import com.example.transcribe_backend.service.LocalStorageService;
import com.example.transcribe_backend.util.ProcessingMethod;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResultPublisherTest {

    private final ObjectMapper om = new ObjectMapper();

    @TempDir
    private Path tempDir;

    @Test
    void publishesResultDocumentAndSubtitles() throws Exception {
        ResultPublisher publisher = new ResultPublisher(new LocalStorageService(tempDir), new StorageProperties(), om,
                Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC));
        UUID jobId = UUID.randomUUID();
        String srt = "1\n00:00:00,000 --> 00:00:00,400\nhello\n\n";

        String reference = publisher.publish(jobId, List.of(new TimedWord("hello", 0.0, 0.4)), srt, "hello",
                "Title", 42, ProcessingMethod.LOCAL);

        Path results = Path.of(URI.create(reference));
        assertEquals(tempDir.resolve("transcriptions/" + jobId + "/results.json").toAbsolutePath().normalize(), results);
        JsonNode doc = om.readTree(results.toFile());
        assertEquals("hello", doc.path("words").get(0).path("word").asText());
        assertEquals(0.4, doc.path("words").get(0).path("end").asDouble());
        assertEquals("hello", doc.path("plain").asText());
        assertEquals("Title", doc.path("metadata").path("title").asText());
        assertEquals(42, doc.path("metadata").path("duration").asInt());
        assertEquals("local", doc.path("metadata").path("processingMethod").asText());
        assertEquals("2026-01-05T10:00:00Z", doc.path("metadata").path("processedAt").asText());
        assertEquals(srt, Files.readString(results.resolveSibling("subtitles.srt")));
    }

    @Test
    void storageFailureIsPersistStageError() {
        StorageProperties props = new StorageProperties();
        props.setResultsPrefix("..");
        ResultPublisher publisher = new ResultPublisher(new LocalStorageService(tempDir.resolve("data")), props, om, Clock.systemUTC());

        ProcessingException ex = assertThrows(ProcessingException.class, () -> publisher.publish(UUID.randomUUID(), List.of(),
                "", "x", "T", 1, ProcessingMethod.REMOTE));

        assertEquals("persist", ex.getStage());
    }
}
