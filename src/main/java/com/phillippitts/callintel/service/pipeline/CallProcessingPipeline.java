package com.phillippitts.callintel.service.pipeline;

import com.phillippitts.callintel.domain.StageRunResult;
import com.phillippitts.callintel.service.extraction.ExtractionOrchestrator;
import com.phillippitts.callintel.service.transcription.TranscriptionWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for webhook handlers and schedulers: transcribe a call, then extract lead
 * intelligence from it.
 *
 * <p>Invocations for different calls are independent tasks on the pipeline executor. Both
 * stages coordinate only through their claims on the call record, so submitting the same call
 * twice is safe: the second pass finds nothing to claim.
 */
@Service
public class CallProcessingPipeline {

    private static final Logger LOG = LogManager.getLogger(CallProcessingPipeline.class);

    private final TranscriptionWorker transcriptionWorker;
    private final ExtractionOrchestrator extractionOrchestrator;
    private final Executor pipelineExecutor;

    public CallProcessingPipeline(TranscriptionWorker transcriptionWorker,
                                  ExtractionOrchestrator extractionOrchestrator,
                                  @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.transcriptionWorker = Objects.requireNonNull(transcriptionWorker, "transcriptionWorker must not be null");
        this.extractionOrchestrator = Objects.requireNonNull(extractionOrchestrator, "extractionOrchestrator must not be null");
        this.pipelineExecutor = Objects.requireNonNull(pipelineExecutor, "pipelineExecutor must not be null");
    }

    /**
     * Runs both stages on the calling thread. Extraction is attempted unless transcription
     * failed; if transcription was skipped because another worker holds it, the extraction
     * claim simply no-ops until that worker finishes.
     */
    public void process(String callId) {
        Objects.requireNonNull(callId, "callId must not be null");
        ThreadContext.put("callId", callId);
        try {
            StageRunResult transcript = transcriptionWorker.transcribe(callId);
            if (transcript == StageRunResult.FAILED) {
                LOG.info("Skipping lead extraction for call {}: transcription failed", callId);
                return;
            }
            StageRunResult extraction = extractionOrchestrator.extract(callId);
            LOG.info("Call {} processed: transcript={}, lead_extraction={}", callId, transcript, extraction);
        } finally {
            ThreadContext.remove("callId");
        }
    }

    /**
     * Schedules {@link #process(String)} on the pipeline executor. The future completes when
     * both stages have written their terminal state; abandoning it does not cancel the work.
     */
    public CompletableFuture<Void> submit(String callId) {
        Objects.requireNonNull(callId, "callId must not be null");
        return CompletableFuture.runAsync(() -> process(callId), pipelineExecutor);
    }

    /**
     * Schedules a standalone lead-extraction pass, e.g. to re-analyze a call whose extraction failed.
     */
    public CompletableFuture<StageRunResult> submitExtraction(String callId) {
        Objects.requireNonNull(callId, "callId must not be null");
        return CompletableFuture.supplyAsync(() -> {
            ThreadContext.put("callId", callId);
            try {
                return extractionOrchestrator.extract(callId);
            } finally {
                ThreadContext.remove("callId");
            }
        }, pipelineExecutor);
    }
}
