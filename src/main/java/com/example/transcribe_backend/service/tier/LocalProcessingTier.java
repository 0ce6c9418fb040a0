package com.example.transcribe_backend.service.tier;

import com.example.transcribe_backend.config.PipelineProperties;
import com.example.transcribe_backend.engine.Interfaces.AlignmentEngine;
import com.example.transcribe_backend.engine.Interfaces.TranscriptionEngine;
import com.example.transcribe_backend.engine.Interfaces.VocalSeparationEngine;
import com.example.transcribe_backend.service.SubtitleService;
import com.example.transcribe_backend.service.download.AudioDownloadService;
import com.example.transcribe_backend.service.download.DownloadResult;
import com.example.transcribe_backend.service.progress.ProgressListener;
import com.example.transcribe_backend.util.PipelineStage;
import com.example.transcribe_backend.util.ProcessingMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Runs the whole pipeline on this host: download, optional vocal isolation, transcription, alignment,
 * subtitle generation and result upload.
 */
@Component
@Order(1)
public class LocalProcessingTier implements ProcessingTier {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalProcessingTier.class);

    private final AudioDownloadService downloader;
    private final VocalSeparationEngine separation;
    private final TranscriptionEngine transcription;
    private final AlignmentEngine alignment;
    private final SubtitleService subtitles;
    private final ResultPublisher publisher;
    private final PipelineProperties.Separation separationProps;

    public LocalProcessingTier(AudioDownloadService downloader,
                               VocalSeparationEngine separation,
                               TranscriptionEngine transcription,
                               AlignmentEngine alignment,
                               SubtitleService subtitles,
                               ResultPublisher publisher,
                               PipelineProperties pipelineProperties) {
        this.downloader = downloader;
        this.separation = separation;
        this.transcription = transcription;
        this.alignment = alignment;
        this.subtitles = subtitles;
        this.publisher = publisher;
        this.separationProps = pipelineProperties.getSeparation();
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public ProcessingMethod method() {
        return ProcessingMethod.LOCAL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public TranscriptionOutcome process(TierRequest request, ProgressListener listener) {
        PipelineArtifacts artifacts = new PipelineArtifacts(request.workDir());
        PipelineStage stage = PipelineStage.DOWNLOAD;
        try {
            listener.stageStarted(stage, "Downloading audio");
            listener.progress(5, "Downloading audio...", stage);
            DownloadResult download = downloader.download(request.sourceReference(), request.workDir().resolve("download"));
            artifacts.setRawAudio(download.audioPath());
            listener.progress(20, "Audio downloaded", stage);
            listener.stageCompleted(stage, "Downloaded via " + download.method() + " (" + download.title() + ")");

            stage = PipelineStage.VOCAL_ISOLATION;
            Optional<String> skipReason = isolationSkipReason(download.durationSeconds());
            if (skipReason.isPresent()) {
                LOGGER.info("ISOLATION SKIP jobId={} reason={}", request.jobId(), skipReason.get());
                listener.stageSkipped(stage, skipReason.get());
                listener.progress(50, "Vocal isolation skipped", stage);
            } else {
                listener.stageStarted(stage, "Separating vocals");
                listener.progress(30, "Separating vocals...", stage);
                Path vocals = separation.separate(artifacts.getRawAudio(), request.workDir().resolve("separated"));
                artifacts.setVocals(vocals);
                listener.progress(50, "Vocals separated", stage);
                listener.stageCompleted(stage, "Vocals isolated");
            }

            stage = PipelineStage.TRANSCRIPTION;
            listener.stageStarted(stage, "Transcribing audio");
            listener.progress(55, "Transcribing audio...", stage);
            TranscriptionEngine.Result transcript = transcription.transcribe(
                    new TranscriptionEngine.Request(request.jobId(), artifacts.transcriptionInput(), null));
            artifacts.setTranscriptText(transcript.text());
            listener.progress(75, "Transcription complete", stage);
            listener.stageCompleted(stage, "Transcribed by " + transcript.provider() + ", words=" + transcript.words().size());

            stage = PipelineStage.ALIGNMENT;
            listener.stageStarted(stage, "Aligning word timestamps");
            listener.progress(80, "Aligning word timestamps...", stage);
            artifacts.setWords(alignment.align(new AlignmentEngine.Request(request.jobId(), artifacts.transcriptionInput(),
                    transcript.text(), transcript.words(), download.durationSeconds(), request.workDir())));
            listener.progress(90, "Alignment complete", stage);
            listener.stageCompleted(stage, "Aligned with " + alignment.name() + ", words=" + artifacts.getWords().size());

            stage = PipelineStage.PERSIST;
            listener.stageStarted(stage, "Saving results");
            artifacts.setSubtitleText(subtitles.toSrt(artifacts.getWords()));
            String plain = transcript.text() == null || transcript.text().isBlank()
                    ? subtitles.toPlainText(artifacts.getWords())
                    : transcript.text();
            String reference = publisher.publish(request.jobId(), artifacts.getWords(), artifacts.getSubtitleText(), plain,
                    download.title(), download.durationSeconds(), ProcessingMethod.LOCAL);
            listener.progress(95, "Results saved", stage);
            listener.stageCompleted(stage, "Results stored");

            return new TranscriptionOutcome(artifacts.getWords(), artifacts.getSubtitleText(), plain, reference,
                    ProcessingMethod.LOCAL, download.title(), download.durationSeconds());
        } catch (RuntimeException e) {
            listener.stageFailed(stage, e.getMessage());
            throw e;
        }
    }

    /**
     * Isolation is skipped when the separation tool is unavailable, or when the memory-safe profile is active and
     * the audio is longer than the configured limit.
     */
    Optional<String> isolationSkipReason(int durationSeconds) {
        if (!separation.isAvailable()) {
            return Optional.of("vocal separation tool unavailable, using original audio");
        }
        if (separationProps.isMemorySafe() && durationSeconds > separationProps.getMaxDurationSeconds()) {
            return Optional.of("audio duration " + durationSeconds + "s exceeds " + separationProps.getMaxDurationSeconds()
                    + "s limit under memory-safe profile, using original audio");
        }
        return Optional.empty();
    }
}
