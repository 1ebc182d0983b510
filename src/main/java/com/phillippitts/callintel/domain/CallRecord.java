package com.phillippitts.callintel.domain;

import java.time.Instant;

/**
 * One recorded call and the durable state of its processing stages.
 *
 * <p>The two stage statuses progress independently, except that lead extraction can only be
 * claimed once the transcript stage is {@link StageStatus#COMPLETED} with non-empty text.
 */
public record CallRecord(
        String id,
        String userId,
        String phoneNumber,
        String recordingUrl,
        String transcriptText,
        StageStatus transcriptStatus,
        String transcriptError,
        Instant transcriptStartedAt,
        Instant transcriptCompletedAt,
        StageStatus leadExtractionStatus,
        String leadExtractionError,
        Instant leadExtractionStartedAt,
        Instant leadExtractionCompletedAt,
        LeadAnalysis individualAnalysis,
        LeadAnalysis completeAnalysis,
        Instant createdAt,
        Instant updatedAt
) {

    public CallRecord {
        if (transcriptStatus == null) {
            transcriptStatus = StageStatus.NONE;
        }
        if (leadExtractionStatus == null) {
            leadExtractionStatus = StageStatus.NONE;
        }
    }

    public boolean hasRecording() {
        return recordingUrl != null && !recordingUrl.isBlank();
    }

    public boolean hasTranscript() {
        return transcriptText != null && !transcriptText.isBlank();
    }
}
