package com.phillippitts.callintel.domain;

/**
 * Call-to-action signals detected in the conversation.
 */
public record CtaInteractions(
        boolean pricingClicked,
        boolean demoClicked,
        boolean followupClicked,
        boolean sampleClicked,
        boolean escalatedToHuman
) {

    public static CtaInteractions none() {
        return new CtaInteractions(false, false, false, false, false);
    }
}
