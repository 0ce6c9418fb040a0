package com.example.transcribe_backend.service.tier;

import com.example.transcribe_backend.service.progress.ProgressListener;
import com.example.transcribe_backend.util.ProcessingMethod;

/**
 * One complete environment able to run the whole pipeline for a job.
 */
public interface ProcessingTier {

    String name();

    ProcessingMethod method();

    boolean isAvailable();

    TranscriptionOutcome process(TierRequest request, ProgressListener listener);
}
