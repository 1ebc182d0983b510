package com.phillippitts.callintel.domain;

/**
 * A user's custom prompt-template ids. Either may be null, meaning "use the system default".
 */
public record PromptOverrides(String individualPromptId, String completePromptId) {

    private static final PromptOverrides NONE = new PromptOverrides(null, null);

    public static PromptOverrides none() {
        return NONE;
    }

    public String forType(AnalysisType type) {
        return type == AnalysisType.INDIVIDUAL ? individualPromptId : completePromptId;
    }
}
