package com.phillippitts.callintel.domain;

import java.time.Instant;

/**
 * Earlier call with the same (user, phone) pair, as needed for the complete analysis.
 *
 * @param callId             call identifier
 * @param transcriptText     completed transcript, or null
 * @param individualAnalysis the call's individual analysis, or null if extraction never completed
 * @param createdAt          when the call record was created
 */
public record PriorCall(
        String callId,
        String transcriptText,
        LeadAnalysis individualAnalysis,
        Instant createdAt
) {

    public boolean hasTranscript() {
        return transcriptText != null && !transcriptText.isBlank();
    }
}
