package com.example.transcribe_backend.service;

import com.example.transcribe_backend.model.TimedWord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Groups timed words into SRT cues of at most ten words and at most five seconds each.
 */
@Service
public class SubtitleService {
    static final int MAX_WORDS_PER_CUE = 10;
    static final double MAX_CUE_SECONDS = 5.0;

    public record Cue(int index, double start, double end, String text) {}

    /**
     * Partitions words in order. A single word longer than the time limit gets a cue of its own.
     */
    public List<List<TimedWord>> chunk(List<TimedWord> words) {
        List<List<TimedWord>> chunks = new ArrayList<>();
        List<TimedWord> current = new ArrayList<>();
        double chunkStart = 0d;
        for (TimedWord word : words) {
            if (!current.isEmpty() && word.end() - chunkStart > MAX_CUE_SECONDS) {
                chunks.add(current);
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                chunkStart = word.start();
            }
            current.add(word);
            if (current.size() >= MAX_WORDS_PER_CUE) {
                chunks.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    public List<Cue> cues(List<TimedWord> words) {
        List<Cue> cues = new ArrayList<>();
        int index = 1;
        for (List<TimedWord> chunk : chunk(words)) {
            String text = chunk.stream().map(TimedWord::word).collect(Collectors.joining(" "));
            cues.add(new Cue(index++, chunk.get(0).start(), chunk.get(chunk.size() - 1).end(), text));
        }
        return cues;
    }

    public String toSrt(List<TimedWord> words) {
        StringBuilder srt = new StringBuilder();
        for (Cue cue : cues(words)) {
            srt.append(cue.index()).append('\n')
                    .append(formatTime(cue.start())).append(" --> ").append(formatTime(cue.end())).append('\n')
                    .append(cue.text()).append("\n\n");
        }
        return srt.toString();
    }

    public String toPlainText(List<TimedWord> words) {
        return words.stream().map(TimedWord::word).collect(Collectors.joining(" "));
    }

    /**
     * Reads SRT text back into cues. Blank lines between cues are optional; multi-line cue text is joined with a space.
     */
    public List<Cue> parse(String srt) {
        List<Cue> cues = new ArrayList<>();
        if (srt == null || srt.isBlank()) {
            return cues;
        }
        String[] lines = srt.replace("\r", "").split("\n");
        int i = 0;
        while (i < lines.length) {
            String indexLine = lines[i++].strip();
            if (indexLine.isEmpty()) {
                continue;
            }
            if (i >= lines.length) {
                break;
            }
            String[] timing = lines[i++].split(" --> ");
            if (timing.length != 2) {
                throw new IllegalArgumentException("Malformed SRT timing line near cue " + indexLine);
            }
            List<String> text = new ArrayList<>();
            while (i < lines.length && !lines[i].strip().isEmpty()) {
                text.add(lines[i++]);
            }
            cues.add(new Cue(Integer.parseInt(indexLine), parseTime(timing[0].strip()), parseTime(timing[1].strip()),
                    String.join(" ", text)));
        }
        return cues;
    }

    /** {@code HH:MM:SS,mmm} */
    static String formatTime(double seconds) {
        long totalMs = Math.round(Math.max(0d, seconds) * 1000.0);
        long hours = totalMs / 3_600_000;
        long minutes = (totalMs % 3_600_000) / 60_000;
        long secs = (totalMs % 60_000) / 1000;
        long ms = totalMs % 1000;
        return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, secs, ms);
    }

    static double parseTime(String time) {
        String[] hmsMs = time.split(",");
        String[] hms = hmsMs[0].split(":");
        if (hmsMs.length != 2 || hms.length != 3) {
            throw new IllegalArgumentException("Malformed SRT time: " + time);
        }
        return Integer.parseInt(hms[0]) * 3600
                + Integer.parseInt(hms[1]) * 60
                + Integer.parseInt(hms[2])
                + Integer.parseInt(hmsMs[1]) / 1000.0;
    }
}
