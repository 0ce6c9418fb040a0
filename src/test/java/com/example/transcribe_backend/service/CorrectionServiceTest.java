package com.example.transcribe_backend.service;

import com.example.transcribe_backend.engine.Interfaces.EmbeddingEngine;
import com.example.transcribe_backend.exception.PersistenceException;
import com.example.transcribe_backend.exception.ProcessingException;
import com.example.transcribe_backend.model.CorrectedSegment;
import com.example.transcribe_backend.repository.CorrectedSegmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CorrectionServiceTest {

    private static final String SRT = """
            1
            00:00:01,000 --> 00:00:03,500
            Hello darkness

            2
            00:00:03,500 --> 00:00:06,000
            my old friend
            """;

    @Mock
    private EmbeddingEngine embeddings;
    @Mock
    private CorrectedSegmentRepository segmentRepo;

    private CorrectionService service;

    @BeforeEach
    void setUp() {
        service = new CorrectionService(new SubtitleService(), embeddings, segmentRepo);
    }

    @Test
    void everyCueIsEmbeddedAndStored() {
        when(embeddings.embed(List.of("Hello darkness", "my old friend")))
                .thenReturn(List.of(List.of(0.1, 0.2), List.of(0.3, 0.4)));
        when(embeddings.model()).thenReturn("text-embedding-3-small");

        int inserted = service.ingest(new CorrectionService.CorrectionRequest(
                "https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=10", " Sound of Silence ", "", SRT));

        assertEquals(2, inserted);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<CorrectedSegment>> rows = ArgumentCaptor.forClass(List.class);
        verify(segmentRepo).saveAll(rows.capture());
        List<CorrectedSegment> saved = rows.getValue();
        assertThat(saved).extracting(CorrectedSegment::getSegmentText).containsExactly("Hello darkness", "my old friend");
        CorrectedSegment first = saved.get(0);
        assertEquals("dQw4w9WgXcQ", first.getVideoId());
        assertEquals("Sound of Silence", first.getTrackTitle());
        assertThat(first.getArtist()).isNull();
        assertEquals(1.0, first.getStartSec(), 1e-9);
        assertEquals(3.5, first.getEndSec(), 1e-9);
        assertEquals(List.of(0.1, 0.2), first.getEmbedding());
        assertEquals("text-embedding-3-small", first.getEmbeddingModel());
    }

    @Test
    void urlWithoutVideoIdIsRejectedBeforeEmbedding() {
        assertThrows(IllegalArgumentException.class, () -> service.ingest(
                new CorrectionService.CorrectionRequest("https://example.com/page", null, null, SRT)));

        verifyNoInteractions(embeddings, segmentRepo);
    }

    @Test
    void malformedSrtIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.ingest(
                new CorrectionService.CorrectionRequest("https://youtu.be/dQw4w9WgXcQ", null, null, "1\nnot a timing line\ntext\n")));

        verifyNoInteractions(embeddings, segmentRepo);
    }

    @Test
    void srtWithoutCuesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.ingest(
                new CorrectionService.CorrectionRequest("https://youtu.be/dQw4w9WgXcQ", null, null, "  \n")));
    }

    @Test
    void shortVectorListStoresNothing() {
        when(embeddings.embed(anyList())).thenReturn(List.of(List.of(0.1)));

        ProcessingException ex = assertThrows(ProcessingException.class, () -> service.ingest(
                new CorrectionService.CorrectionRequest("https://youtu.be/dQw4w9WgXcQ", null, null, SRT)));

        assertEquals("embedding", ex.getStage());
        verify(segmentRepo, never()).saveAll(any());
    }

    @Test
    void storeFailureIsWrapped() {
        when(embeddings.embed(anyList())).thenReturn(List.of(List.of(0.1), List.of(0.2)));
        when(embeddings.model()).thenReturn("text-embedding-3-small");
        when(segmentRepo.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("down"));

        PersistenceException ex = assertThrows(PersistenceException.class, () -> service.ingest(
                new CorrectionService.CorrectionRequest("https://youtu.be/dQw4w9WgXcQ", null, null, SRT)));

        assertThat(ex.getMessage()).contains("dQw4w9WgXcQ");
    }

    @Test
    void videoIdIsFoundInCommonUrlShapes() {
        assertEquals("dQw4w9WgXcQ", CorrectionService.extractVideoId("https://youtu.be/dQw4w9WgXcQ?si=abc").orElseThrow());
        assertEquals("dQw4w9WgXcQ", CorrectionService.extractVideoId("https://www.youtube.com/watch?v=dQw4w9WgXcQ").orElseThrow());
        assertEquals("dQw4w9WgXcQ", CorrectionService.extractVideoId("https://www.youtube.com/shorts/dQw4w9WgXcQ").orElseThrow());
        assertEquals("dQw4w9WgXcQ", CorrectionService.extractVideoId("https://www.youtube.com/embed/dQw4w9WgXcQ").orElseThrow());
        assertThat(CorrectionService.extractVideoId("https://vimeo.com/123")).isEmpty();
        assertThat(CorrectionService.extractVideoId(" ")).isEmpty();
    }
}
