package com.phillippitts.callintel.domain;

/**
 * Contact details and free-form notes pulled from the transcript. Every field is optional.
 *
 * <p>{@code smartNotification} is a cross-call signal: it is only meaningful on individual
 * analyses and is always stored empty on complete analyses.
 */
public record ContactExtraction(
        String name,
        String emailAddress,
        String companyName,
        String smartNotification,
        String requirements,
        String customCta,
        String inDetailSummary
) {

    public static ContactExtraction empty() {
        return new ContactExtraction(null, null, null, null, null, null, null);
    }

    public ContactExtraction withSmartNotification(String value) {
        return new ContactExtraction(name, emailAddress, companyName, value,
                requirements, customCta, inDetailSummary);
    }
}
