package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.domain.AnalysisType;
import com.phillippitts.callintel.domain.CallRecord;
import com.phillippitts.callintel.domain.LeadAnalysis;
import com.phillippitts.callintel.domain.LeadAnalysisJson;
import com.phillippitts.callintel.domain.PriorCall;
import com.phillippitts.callintel.domain.ProcessingStage;
import com.phillippitts.callintel.domain.PromptOverrides;
import com.phillippitts.callintel.domain.StageOutcome;
import com.phillippitts.callintel.domain.StageRunResult;
import com.phillippitts.callintel.repository.CallRecordRepository;
import com.phillippitts.callintel.repository.UserPromptRepository;
import com.phillippitts.callintel.service.metrics.PipelineMetrics;
import com.phillippitts.callintel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.List;
import java.util.Objects;

/**
 * Lead-extraction stage of call processing.
 *
 * <p>State machine on {@code lead_extraction_status}: {@code none|failed -> processing -> completed|failed}.
 * The claim only succeeds once the transcript stage has completed with non-empty text, so
 * calling this early is a harmless no-op.
 *
 * <p>Produces two analyses per call:
 * <ul>
 *   <li><b>Individual</b>: the current transcript alone.</li>
 *   <li><b>Complete</b>: the contact's cumulative disposition. Equal to the individual analysis
 *       for a first call; otherwise a second extraction over the current transcript plus up to
 *       {@code priorCallLimit} earlier calls.</li>
 * </ul>
 * The smart-notification field of the complete analysis is always stored empty. Both analyses
 * are written in the single terminal update; nothing is persisted on a partial failure.
 */
public class ExtractionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(ExtractionOrchestrator.class);

    private final CallRecordRepository repository;
    private final UserPromptRepository userPromptRepository;
    private final PromptTemplateResolver promptResolver;
    private final StructuredExtractionClient extractionClient;
    private final int priorCallLimit;
    private final PipelineMetrics metrics;

    public ExtractionOrchestrator(CallRecordRepository repository,
                                  UserPromptRepository userPromptRepository,
                                  PromptTemplateResolver promptResolver,
                                  StructuredExtractionClient extractionClient,
                                  int priorCallLimit,
                                  PipelineMetrics metrics) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.userPromptRepository = Objects.requireNonNull(userPromptRepository, "userPromptRepository must not be null");
        this.promptResolver = Objects.requireNonNull(promptResolver, "promptResolver must not be null");
        this.extractionClient = Objects.requireNonNull(extractionClient, "extractionClient must not be null");
        if (priorCallLimit < 1) {
            throw new IllegalArgumentException("priorCallLimit must be >= 1, got: " + priorCallLimit);
        }
        this.priorCallLimit = priorCallLimit;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Runs one lead-extraction pass for the call.
     *
     * @return {@link StageRunResult#SKIPPED} if the record could not be claimed, otherwise the
     *         terminal outcome that was written
     */
    public StageRunResult extract(String callId) {
        long startNanos = System.nanoTime();
        ThreadContext.put("stage", ProcessingStage.LEAD_EXTRACTION.columnPrefix());
        try {
            StageRunResult result = run(callId);
            metrics.recordStage(ProcessingStage.LEAD_EXTRACTION, result, System.nanoTime() - startNanos);
            return result;
        } finally {
            ThreadContext.remove("stage");
        }
    }

    private StageRunResult run(String callId) {
        boolean claimed;
        try {
            claimed = repository.claimForProcessing(callId, ProcessingStage.LEAD_EXTRACTION);
        } catch (RuntimeException e) {
            LOG.error("Could not claim call {} for lead extraction", callId, e);
            return StageRunResult.FAILED;
        }
        if (!claimed) {
            LOG.info("Lead extraction for call {} not claimable (transcript not ready, in progress or completed)",
                    callId);
            return StageRunResult.SKIPPED;
        }

        try {
            CallRecord record = repository.findById(callId)
                    .orElseThrow(() -> new IllegalStateException("Call record " + callId + " vanished after claim"));
            if (!record.hasTranscript()) {
                throw new IllegalStateException("Call record " + callId + " has no transcript");
            }
            PromptOverrides overrides = userPromptRepository.findPromptOverrides(record.userId());

            LeadAnalysis individual = analyze(AnalysisType.INDIVIDUAL, overrides, record.transcriptText(), null);

            List<PriorCall> priorCalls = repository.findRecentPriorCalls(
                    record.userId(), record.phoneNumber(), callId, priorCallLimit);
            LeadAnalysis complete;
            if (priorCalls.isEmpty()) {
                LOG.info("No prior calls for {}; complete analysis mirrors the individual one",
                        LogSanitizer.maskPhone(record.phoneNumber()));
                complete = individual.withoutSmartNotification();
            } else {
                LOG.info("Building complete analysis over {} prior call(s) for {}",
                        priorCalls.size(), LogSanitizer.maskPhone(record.phoneNumber()));
                complete = analyze(AnalysisType.COMPLETE, overrides, record.transcriptText(),
                        ExtractionHistory.from(priorCalls)).withoutSmartNotification();
            }

            repository.writeStageResult(callId, ProcessingStage.LEAD_EXTRACTION,
                    StageOutcome.leadExtractionCompleted(individual, complete));
            LOG.info("Lead extraction of call {} completed: individual total={}, complete total={}, tag={}",
                    callId, individual.totalScore(), complete.totalScore(), complete.leadStatusTag());
            return StageRunResult.COMPLETED;
        } catch (RuntimeException e) {
            LOG.error("Lead extraction of call {} failed: {}", callId, e.getMessage(), e);
            return fail(callId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private LeadAnalysis analyze(AnalysisType type, PromptOverrides overrides, String transcript,
                                 ExtractionHistory history) {
        String promptId = promptResolver.resolve(overrides.forType(type), type);
        return LeadAnalysisJson.fromJson(extractionClient.extract(promptId, transcript, history));
    }

    private StageRunResult fail(String callId, String message) {
        try {
            repository.writeStageResult(callId, ProcessingStage.LEAD_EXTRACTION, StageOutcome.failed(message));
        } catch (RuntimeException e) {
            LOG.error("Could not record lead-extraction failure for call {}", callId, e);
        }
        return StageRunResult.FAILED;
    }
}
