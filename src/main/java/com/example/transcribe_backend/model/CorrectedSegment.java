package com.example.transcribe_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One cue of a human-corrected transcript with the embedding of its text.
 */
@Entity
@Table(
        name = "corrected_segments",
        indexes = {
                @Index(name = "idx_corrected_segments_video", columnList = "youtube_video_id")
        }
)
public class CorrectedSegment {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "youtube_video_id", nullable = false, length = 32)
    private String videoId;

    @Column(name = "artist", columnDefinition = "text")
    private String artist;

    @Column(name = "track_title", columnDefinition = "text")
    private String trackTitle;

    @Column(name = "segment_text", nullable = false, columnDefinition = "text")
    private String segmentText;

    @Column(name = "start_sec", nullable = false)
    private double startSec;

    @Column(name = "end_sec", nullable = false)
    private double endSec;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "embedding", nullable = false)
    private List<Double> embedding = new ArrayList<>();

    @Column(name = "embedding_model", nullable = false, length = 64)
    private String embeddingModel;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected CorrectedSegment() {}

    public CorrectedSegment(String videoId, String artist, String trackTitle, String segmentText,
                            double startSec, double endSec, List<Double> embedding, String embeddingModel) {
        this.videoId = videoId;
        this.artist = artist;
        this.trackTitle = trackTitle;
        this.segmentText = segmentText;
        this.startSec = startSec;
        this.endSec = endSec;
        this.embedding = embedding;
        this.embeddingModel = embeddingModel;
    }

    public UUID getId() {
        return id;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getArtist() {
        return artist;
    }

    public String getTrackTitle() {
        return trackTitle;
    }

    public String getSegmentText() {
        return segmentText;
    }

    public double getStartSec() {
        return startSec;
    }

    public double getEndSec() {
        return endSec;
    }

    public List<Double> getEmbedding() {
        return embedding == null ? List.of() : embedding;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
