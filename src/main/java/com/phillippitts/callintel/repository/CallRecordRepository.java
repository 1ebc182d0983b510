package com.phillippitts.callintel.repository;

import com.phillippitts.callintel.domain.CallRecord;
import com.phillippitts.callintel.domain.PriorCall;
import com.phillippitts.callintel.domain.ProcessingStage;
import com.phillippitts.callintel.domain.StageOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read/write surface of the call-record store used by the processing pipeline.
 *
 * <p>Every method is a single atomic statement. No transaction spans claim, work and
 * terminal write; a worker that dies in between leaves the stage in {@code processing}.
 */
public interface CallRecordRepository {

    /**
     * Atomically moves the stage to {@code processing} if, and only if, it is claimable.
     *
     * <p>Transcript: claimable from {@code none}, {@code failed} or NULL.
     * Lead extraction: additionally requires a completed, non-empty transcript.
     *
     * @return true when this caller now owns the stage; false when another worker holds it,
     *         it is already completed, its preconditions are not met, or the record does not exist
     */
    boolean claimForProcessing(String callId, ProcessingStage stage);

    Optional<CallRecord> findById(String callId);

    /**
     * Writes the terminal status of a stage, together with its payload when completed.
     *
     * @return true when a row was updated
     */
    boolean writeStageResult(String callId, ProcessingStage stage, StageOutcome outcome);

    /**
     * Earlier calls of the same (user, phone) pair that have a completed transcript or an
     * individual analysis, most recent first, excluding {@code excludeCallId}.
     */
    List<PriorCall> findRecentPriorCalls(String userId, String phoneNumber, String excludeCallId, int limit);

    /**
     * Ids of records whose stage has been {@code processing} since before the given instant.
     */
    List<String> findStuckInProcessing(ProcessingStage stage, Instant startedBefore);
}
