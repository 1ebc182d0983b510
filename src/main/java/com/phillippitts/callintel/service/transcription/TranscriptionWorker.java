package com.phillippitts.callintel.service.transcription;

import com.phillippitts.callintel.domain.ProcessingStage;
import com.phillippitts.callintel.domain.StageOutcome;
import com.phillippitts.callintel.domain.StageRunResult;
import com.phillippitts.callintel.repository.CallRecordRepository;
import com.phillippitts.callintel.service.metrics.PipelineMetrics;
import com.phillippitts.callintel.service.retry.RetryConfig;
import com.phillippitts.callintel.service.retry.RetryExecutor;
import com.phillippitts.callintel.service.retry.RetryResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Transcript stage of call processing.
 *
 * <p>State machine on {@code transcript_status}: {@code none|failed -> processing -> completed|failed}.
 * <ol>
 *   <li>Claim the record with a single conditional update; a lost claim is a silent no-op.</li>
 *   <li>Wait (bounded) for the recording URL, which may arrive after the triggering event.</li>
 *   <li>Download and transcribe, retrying only while the recording is not yet downloadable.</li>
 *   <li>Write the transcript and {@code completed}, or {@code failed} with the error message.</li>
 * </ol>
 *
 * <p>Failures are recorded on the row and never thrown to the caller; re-invoking after a
 * failure is always safe.
 */
public class TranscriptionWorker {

    private static final Logger LOG = LogManager.getLogger(TranscriptionWorker.class);

    static final String OPERATION = "speech_to_text";

    private final CallRecordRepository repository;
    private final RecordingUrlResolver recordingUrlResolver;
    private final SpeechToTextClient speechToTextClient;
    private final RetryExecutor retryExecutor;
    private final RetryConfig retryConfig;
    private final Duration attemptTimeout;
    private final PipelineMetrics metrics;

    public TranscriptionWorker(CallRecordRepository repository,
                               RecordingUrlResolver recordingUrlResolver,
                               SpeechToTextClient speechToTextClient,
                               RetryExecutor retryExecutor,
                               RetryConfig retryConfig,
                               Duration attemptTimeout,
                               PipelineMetrics metrics) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.recordingUrlResolver = Objects.requireNonNull(recordingUrlResolver, "recordingUrlResolver must not be null");
        this.speechToTextClient = Objects.requireNonNull(speechToTextClient, "speechToTextClient must not be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
        this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig must not be null");
        this.attemptTimeout = Objects.requireNonNull(attemptTimeout, "attemptTimeout must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Runs one transcript pass for the call.
     *
     * @return {@link StageRunResult#SKIPPED} if the record could not be claimed, otherwise the
     *         terminal outcome that was written
     */
    public StageRunResult transcribe(String callId) {
        long startNanos = System.nanoTime();
        ThreadContext.put("stage", ProcessingStage.TRANSCRIPT.columnPrefix());
        try {
            StageRunResult result = run(callId);
            metrics.recordStage(ProcessingStage.TRANSCRIPT, result, System.nanoTime() - startNanos);
            return result;
        } finally {
            ThreadContext.remove("stage");
        }
    }

    private StageRunResult run(String callId) {
        boolean claimed;
        try {
            claimed = repository.claimForProcessing(callId, ProcessingStage.TRANSCRIPT);
        } catch (RuntimeException e) {
            LOG.error("Could not claim call {} for transcription", callId, e);
            return StageRunResult.FAILED;
        }
        if (!claimed) {
            LOG.info("Transcription for call {} not claimable (in progress elsewhere or already completed)", callId);
            return StageRunResult.SKIPPED;
        }

        try {
            Optional<String> recordingUrl = recordingUrlResolver.awaitRecordingUrl(callId);
            if (recordingUrl.isEmpty()) {
                return fail(callId, "Recording URL not available after "
                        + recordingUrlResolver.waitTimeout().toMillis() + " ms");
            }

            String url = recordingUrl.get();
            RetryResult<String> result = retryExecutor.executeWithRetryAndTimeout(
                    () -> speechToTextClient.transcribe(url),
                    retryConfig,
                    attemptTimeout,
                    "Transcription of call " + callId);
            metrics.recordAttempts(OPERATION, result.attempts());

            if (!result.success()) {
                return fail(callId, result.errorMessage());
            }

            String text = result.value() == null ? "" : result.value().trim();
            if (text.isEmpty()) {
                LOG.warn("Transcription of call {} returned no speech", callId);
            }
            repository.writeStageResult(callId, ProcessingStage.TRANSCRIPT, StageOutcome.transcriptCompleted(text));
            LOG.info("Transcription of call {} completed: {} chars in {} attempt(s)",
                    callId, text.length(), result.attempts());
            return StageRunResult.COMPLETED;
        } catch (RuntimeException e) {
            LOG.error("Transcription of call {} failed unexpectedly", callId, e);
            return fail(callId, e.getMessage());
        }
    }

    private StageRunResult fail(String callId, String message) {
        LOG.warn("Transcription of call {} failed: {}", callId, message);
        try {
            repository.writeStageResult(callId, ProcessingStage.TRANSCRIPT, StageOutcome.failed(message));
        } catch (RuntimeException e) {
            LOG.error("Could not record transcription failure for call {}", callId, e);
        }
        return StageRunResult.FAILED;
    }
}
