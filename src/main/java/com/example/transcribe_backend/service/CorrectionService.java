package com.example.transcribe_backend.service;

import com.example.transcribe_backend.engine.Interfaces.EmbeddingEngine;
import com.example.transcribe_backend.exception.PersistenceException;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.model.CorrectedSegment;
import com.example.transcribe_backend.repository.CorrectedSegmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ingests a corrected SRT for a video: every cue is embedded and stored as a reference segment.
 */
@Service
public class CorrectionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CorrectionService.class);
    private static final Pattern VIDEO_ID = Pattern.compile(
            "(?:youtube\\.com/(?:[^/]+/.+/|(?:v|e(?:mbed)?|shorts)/|.*[?&]v=)|youtu\\.be/)([A-Za-z0-9_-]{11})");

    private final SubtitleService subtitles;
    private final EmbeddingEngine embeddings;
    private final CorrectedSegmentRepository segmentRepo;

    public CorrectionService(SubtitleService subtitles, EmbeddingEngine embeddings, CorrectedSegmentRepository segmentRepo) {
        this.subtitles = subtitles;
        this.embeddings = embeddings;
        this.segmentRepo = segmentRepo;
    }

    public record CorrectionRequest(String sourceUrl, @Nullable String title, @Nullable String artist, String srt) {}

    /**
     * @return number of segments stored.
     * @throws IllegalArgumentException when the URL names no video or the SRT is malformed or empty.
     */
    public int ingest(CorrectionRequest request) {
        String videoId = extractVideoId(request.sourceUrl())
                .orElseThrow(() -> new IllegalArgumentException("Unable to extract video ID from URL"));
        List<SubtitleService.Cue> cues = subtitles.parse(request.srt()).stream()
                .filter(cue -> !cue.text().isBlank())
                .toList();
        if (cues.isEmpty()) {
            throw new IllegalArgumentException("SRT contains no cues");
        }

        List<List<Double>> vectors = embeddings.embed(cues.stream().map(SubtitleService.Cue::text).toList());
        if (vectors.size() != cues.size()) {
            throw new ProcessingException("embedding",
                    "Embedding returned %d vectors for %d cues".formatted(vectors.size(), cues.size()));
        }

        List<CorrectedSegment> rows = new ArrayList<>(cues.size());
        for (int i = 0; i < cues.size(); i++) {
            SubtitleService.Cue cue = cues.get(i);
            rows.add(new CorrectedSegment(videoId, blankToNull(request.artist()), blankToNull(request.title()),
                    cue.text(), cue.start(), cue.end(), vectors.get(i), embeddings.model()));
        }
        try {
            segmentRepo.saveAll(rows);
        } catch (RuntimeException e) {
            throw new PersistenceException("Storing corrected segments for video " + videoId + " failed: " + e.getMessage(), e);
        }
        LOGGER.info("CORRECTION STORED videoId={} segments={} model={}", videoId, rows.size(), embeddings.model());
        return rows.size();
    }

    public List<CorrectedSegment> segmentsFor(String videoId) {
        return segmentRepo.findByVideoIdOrderByStartSecAsc(videoId);
    }

    static Optional<String> extractVideoId(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.strip();
        try {
            UriComponents uri = UriComponentsBuilder.fromUriString(trimmed).build();
            String host = uri.getHost() == null ? "" : uri.getHost();
            String path = uri.getPath() == null ? "" : uri.getPath();
            if (host.contains("youtu.be") && path.length() > 1) {
                return Optional.of(path.substring(1).split("/")[0]);
            }
            String v = uri.getQueryParams().getFirst("v");
            if (v != null && !v.isBlank()) {
                return Optional.of(v);
            }
            if (path.startsWith("/shorts/") && path.length() > "/shorts/".length()) {
                return Optional.of(path.substring("/shorts/".length()).split("/")[0]);
            }
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Unparseable correction URL, trying pattern url={}", trimmed);
        }
        Matcher m = VIDEO_ID.matcher(trimmed);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static String blankToNull(@Nullable String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
