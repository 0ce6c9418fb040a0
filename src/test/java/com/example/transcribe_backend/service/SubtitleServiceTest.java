package com.example.transcribe_backend.service;

import com.example.transcribe_backend.model.TimedWord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SubtitleServiceTest {

    private final SubtitleService subtitles = new SubtitleService();

    @Test
    void shortPhraseBecomesSingleCue() {
        List<TimedWord> words = List.of(
                new TimedWord("the", 0.0, 0.3),
                new TimedWord("quick", 0.3, 0.6),
                new TimedWord("fox", 0.6, 0.9));

        String srt = subtitles.toSrt(words);

        assertEquals("1\n00:00:00,000 --> 00:00:00,900\nthe quick fox\n\n", srt);
        assertEquals("the quick fox", subtitles.toPlainText(words));
    }

    @Test
    void splitsAfterTenWords() {
        List<TimedWord> words = evenlySpaced(23, 0.2);

        List<List<TimedWord>> chunks = subtitles.chunk(words);

        assertThat(chunks).extracting(List::size).containsExactly(10, 10, 3);
        assertThat(chunks.stream().flatMap(List::stream).toList()).isEqualTo(words);
    }

    @Test
    void splitsBeforeExceedingFiveSeconds() {
        List<TimedWord> words = evenlySpaced(8, 1.0);

        List<SubtitleService.Cue> cues = subtitles.cues(words);

        assertThat(cues).hasSize(2);
        assertEquals(0.0, cues.get(0).start());
        assertEquals(5.0, cues.get(0).end());
        assertEquals(5.0, cues.get(1).start());
        assertThat(cues).allMatch(c -> c.end() - c.start() <= SubtitleService.MAX_CUE_SECONDS);
        assertThat(cues).extracting(SubtitleService.Cue::index).containsExactly(1, 2);
    }

    @Test
    void overlongWordGetsItsOwnCue() {
        List<TimedWord> words = List.of(
                new TimedWord("hello", 0.0, 0.5),
                new TimedWord("loooong", 0.5, 7.0),
                new TimedWord("bye", 7.0, 7.4));

        List<List<TimedWord>> chunks = subtitles.chunk(words);

        assertThat(chunks).extracting(List::size).containsExactly(1, 1, 1);
    }

    @Test
    void emptyInputProducesEmptySrt() {
        assertEquals("", subtitles.toSrt(List.of()));
        assertThat(subtitles.parse("")).isEmpty();
    }

    @Test
    void parseReadsBackRenderedCues() {
        List<TimedWord> words = evenlySpaced(14, 0.45);
        List<SubtitleService.Cue> rendered = subtitles.cues(words);

        List<SubtitleService.Cue> parsed = subtitles.parse(subtitles.toSrt(words));

        assertThat(parsed).hasSize(rendered.size());
        for (int i = 0; i < parsed.size(); i++) {
            assertEquals(rendered.get(i).index(), parsed.get(i).index());
            assertEquals(rendered.get(i).text(), parsed.get(i).text());
            assertEquals(rendered.get(i).start(), parsed.get(i).start(), 0.001);
            assertEquals(rendered.get(i).end(), parsed.get(i).end(), 0.001);
        }
    }

    @Test
    void formatsHoursAndRoundsToMillis() {
        assertEquals("01:01:01,500", SubtitleService.formatTime(3661.4996));
        assertEquals("00:00:00,000", SubtitleService.formatTime(-2));
        assertEquals(3661.5, SubtitleService.parseTime("01:01:01,500"), 1e-9);
    }

    private static List<TimedWord> evenlySpaced(int count, double step) {
        List<TimedWord> words = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            words.add(new TimedWord("w" + i, i * step, (i + 1) * step));
        }
        return words;
    }
}
