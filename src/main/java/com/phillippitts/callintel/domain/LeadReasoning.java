package com.phillippitts.callintel.domain;

/**
 * Free-text reasoning behind each lead-scoring dimension.
 */
public record LeadReasoning(
        String intent,
        String urgency,
        String budget,
        String fit,
        String engagement,
        String ctaBehavior
) {

    public static LeadReasoning empty() {
        return new LeadReasoning(null, null, null, null, null, null);
    }
}
