package com.phillippitts.callintel.domain;

import java.util.Objects;

/**
 * Terminal result of one stage pass, written to the call record in a single statement.
 *
 * <p>Use the factory methods; a completed lead extraction always carries both analyses so the
 * write is all-or-nothing.
 */
public record StageOutcome(
        StageStatus status,
        String errorMessage,
        String transcriptText,
        LeadAnalysis individualAnalysis,
        LeadAnalysis completeAnalysis
) {

    public StageOutcome {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Stage outcome must be terminal, got: " + status);
        }
    }

    public static StageOutcome transcriptCompleted(String transcriptText) {
        return new StageOutcome(StageStatus.COMPLETED, null,
                Objects.requireNonNull(transcriptText, "transcriptText"), null, null);
    }

    public static StageOutcome leadExtractionCompleted(LeadAnalysis individual, LeadAnalysis complete) {
        return new StageOutcome(StageStatus.COMPLETED, null, null,
                Objects.requireNonNull(individual, "individual"),
                Objects.requireNonNull(complete, "complete"));
    }

    public static StageOutcome failed(String errorMessage) {
        return new StageOutcome(StageStatus.FAILED,
                errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage,
                null, null, null);
    }

    public boolean isCompleted() {
        return status == StageStatus.COMPLETED;
    }
}
