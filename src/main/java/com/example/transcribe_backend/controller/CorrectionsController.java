package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.exception.PersistenceException;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.model.CorrectedSegment;
import com.example.transcribe_backend.service.CorrectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/v1/corrections")
public class CorrectionsController {
    private static final Logger LOGGER = LoggerFactory.getLogger(CorrectionsController.class);

    private final CorrectionService correctionService;

    public CorrectionsController(CorrectionService correctionService) {
        this.correctionService = correctionService;
    }

    public record CorrectionReq(
            @NotBlank @Size(max = 2048) String youtubeUrl,
            @Size(max = 512) String title,
            @Size(max = 512) String artist,
            @NotBlank String srt
    ) {}
    public record CorrectionRes(String status, int inserted) {}
    public record SegmentRes(String text, double start, double end, String artist, String title) {
        static SegmentRes of(CorrectedSegment s) {
            return new SegmentRes(s.getSegmentText(), s.getStartSec(), s.getEndSec(), s.getArtist(), s.getTrackTitle());
        }
    }

    @Operation(summary = "Store a corrected transcript as embedded reference segments")
    @ApiResponse(responseCode = "200", description = "Segments stored")
    @ApiResponse(responseCode = "400", description = "No video ID in the URL or unreadable SRT")
    @ApiResponse(responseCode = "502", description = "Embedding provider failed")
    @PostMapping
    public CorrectionRes ingest(@Valid @RequestBody CorrectionReq req) {
        try {
            int inserted = correctionService.ingest(
                    new CorrectionService.CorrectionRequest(req.youtubeUrl(), req.title(), req.artist(), req.srt()));
            return new CorrectionRes("ok", inserted);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (ProcessingException e) {
            LOGGER.warn("Correction embedding failed url={} error={}", req.youtubeUrl(), e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        } catch (PersistenceException e) {
            LOGGER.error("Correction not stored url={} error={}", req.youtubeUrl(), e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        }
    }

    @Operation(summary = "Stored corrected segments of a video in time order")
    @GetMapping("/{videoId}")
    public List<SegmentRes> segments(@PathVariable String videoId) {
        return correctionService.segmentsFor(videoId).stream().map(SegmentRes::of).toList();
    }
}
