package com.phillippitts.callintel.domain;

import java.util.Objects;

/**
 * Structured lead-quality analysis produced by the extraction service.
 *
 * <p>The same shape serves both analysis types: an individual analysis describes one call
 * and never changes after it is stored; a complete analysis is the contact's cumulative
 * disposition and is overwritten after every new qualifying call.
 *
 * <p>Scores are per dimension (intent, urgency, budget, fit, engagement), each paired with a
 * categorical level. {@code totalScore} and {@code leadStatusTag} are derived by the model.
 */
public record LeadAnalysis(
        String intentLevel,
        int intentScore,
        String urgencyLevel,
        int urgencyScore,
        String budgetConstraint,
        int budgetScore,
        String fitAlignment,
        int fitScore,
        String engagementHealth,
        int engagementScore,
        int totalScore,
        String leadStatusTag,
        String demoBookDatetime,
        String transcriptSummary,
        LeadReasoning reasoning,
        CtaInteractions ctaInteractions,
        ContactExtraction extraction
) {

    public LeadAnalysis {
        reasoning = Objects.requireNonNullElseGet(reasoning, LeadReasoning::empty);
        ctaInteractions = Objects.requireNonNullElseGet(ctaInteractions, CtaInteractions::none);
        extraction = Objects.requireNonNullElseGet(extraction, ContactExtraction::empty);
    }

    public int dimensionScoreSum() {
        return intentScore + urgencyScore + budgetScore + fitScore + engagementScore;
    }

    /**
     * Copy of this analysis with the smart-notification field set to the empty string.
     */
    public LeadAnalysis withoutSmartNotification() {
        return new LeadAnalysis(intentLevel, intentScore, urgencyLevel, urgencyScore,
                budgetConstraint, budgetScore, fitAlignment, fitScore,
                engagementHealth, engagementScore, totalScore, leadStatusTag,
                demoBookDatetime, transcriptSummary, reasoning, ctaInteractions,
                extraction.withSmartNotification(""));
    }
}
