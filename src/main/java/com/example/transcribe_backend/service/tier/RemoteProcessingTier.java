package com.example.transcribe_backend.service.tier;

import com.example.transcribe_backend.exception.RemoteUnavailableException;
import com.example.transcribe_backend.exception.TranscribeException;
import com.example.transcribe_backend.service.SubtitleService;
import com.example.transcribe_backend.service.progress.ProgressListener;
import com.example.transcribe_backend.service.remote.RemoteTierClient;
import com.example.transcribe_backend.util.PipelineStage;
import com.example.transcribe_backend.util.ProcessingMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Delegates the whole pipeline to the remote accelerated tier. Missing subtitle or plain text is derived
 * from the returned words; a result without a stored reference is uploaded here.
 */
@Component
@Order(2)
public class RemoteProcessingTier implements ProcessingTier {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteProcessingTier.class);

    private final RemoteTierClient client;
    private final SubtitleService subtitles;
    private final ResultPublisher publisher;

    public RemoteProcessingTier(RemoteTierClient client, SubtitleService subtitles, ResultPublisher publisher) {
        this.client = client;
        this.subtitles = subtitles;
        this.publisher = publisher;
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public ProcessingMethod method() {
        return ProcessingMethod.REMOTE;
    }

    @Override
    public boolean isAvailable() {
        return client.isConfigured();
    }

    /**
     * @throws RemoteUnavailableException on any failure; remote failures are always terminal.
     */
    @Override
    public TranscriptionOutcome process(TierRequest request, ProgressListener listener) {
        PipelineStage stage = PipelineStage.REMOTE;
        listener.stageStarted(stage, "Processing on remote tier");
        listener.progress(10, "Processing on remote tier...", stage);
        try {
            RemoteTierClient.RemoteResult result = client.transcribe(request.jobId(), request.sourceReference(), request.modelPreference());
            listener.progress(90, "Remote processing complete", stage);

            String srt = result.srt() == null || result.srt().isBlank() ? subtitles.toSrt(result.words()) : result.srt();
            String plain = result.plain() == null || result.plain().isBlank() ? subtitles.toPlainText(result.words()) : result.plain();
            String title = result.title() == null || result.title().isBlank() ? "Unknown Title" : result.title();
            String reference = result.resultsReference();
            if (reference == null) {
                reference = publisher.publish(request.jobId(), result.words(), srt, plain, title, result.durationSeconds(),
                        ProcessingMethod.REMOTE);
            }
            listener.progress(95, "Results saved", stage);
            listener.stageCompleted(stage, "Remote tier succeeded, words=" + result.words().size());
            LOGGER.info("REMOTE OK jobId={} words={} reference={}", request.jobId(), result.words().size(), reference);
            return new TranscriptionOutcome(result.words(), srt, plain, reference, ProcessingMethod.REMOTE,
                    title, result.durationSeconds());
        } catch (RemoteUnavailableException e) {
            listener.stageFailed(stage, e.getMessage());
            throw e;
        } catch (TranscribeException | IllegalArgumentException e) {
            listener.stageFailed(stage, e.getMessage());
            throw new RemoteUnavailableException("Remote tier result could not be stored: " + e.getMessage(), e);
        }
    }
}
