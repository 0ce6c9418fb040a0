package com.example.transcribe_backend.service.tier;

import com.example.transcribe_backend.service.progress.ProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Tries tiers in cost order. A failed tier hands over to the next available one; the failure of the last
 * available tier is the job's error, unchanged. Local first, remote second: without a remote tier the local
 * failure surfaces as-is, and a remote failure is always terminal.
 */
@Service
public class TieredProcessingOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(TieredProcessingOrchestrator.class);

    private final List<ProcessingTier> tiers;
    private final ProgressTracker progress;

    public TieredProcessingOrchestrator(List<ProcessingTier> tiers, ProgressTracker progress) {
        if (tiers.isEmpty()) {
            throw new IllegalStateException("No processing tiers registered");
        }
        this.tiers = List.copyOf(tiers);
        this.progress = progress;
        LOGGER.info("Processing tiers={}", this.tiers.stream().map(ProcessingTier::name).toList());
    }

    public TranscriptionOutcome process(TierRequest request) {
        List<ProcessingTier> available = tiers.stream().filter(ProcessingTier::isAvailable).toList();
        if (available.isEmpty()) {
            throw new IllegalStateException("No processing tier available for job " + request.jobId());
        }
        RuntimeException previous = null;
        for (int i = 0; i < available.size(); i++) {
            ProcessingTier tier = available.get(i);
            boolean last = i == available.size() - 1;
            LOGGER.info("TIER ATTEMPT jobId={} tier={}", request.jobId(), tier.name());
            try {
                TranscriptionOutcome outcome = tier.process(request, progress.listenerFor(request.jobId(), tier.method()));
                LOGGER.info("TIER OK jobId={} tier={} method={}", request.jobId(), tier.name(), outcome.processingMethod().tag());
                return outcome;
            } catch (RuntimeException e) {
                if (previous != null) {
                    e.addSuppressed(previous);
                }
                if (last) {
                    LOGGER.error("TIER FAIL jobId={} tier={} terminal error={}", request.jobId(), tier.name(), e.getMessage());
                    throw e;
                }
                LOGGER.warn("TIER FAIL jobId={} tier={} fallback={} error={}", request.jobId(), tier.name(),
                        available.get(i + 1).name(), e.getMessage());
                previous = e;
            }
        }
        throw new IllegalStateException("unreachable");
    }
}
