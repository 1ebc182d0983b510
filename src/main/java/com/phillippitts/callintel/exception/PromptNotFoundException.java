package com.phillippitts.callintel.exception;

/**
 * Thrown when the reasoning service reports that the configured prompt template id does not
 * exist for the current API credential. Triggers the default-model fallback path.
 */
public class PromptNotFoundException extends UpstreamException {

    private final String promptId;

    public PromptNotFoundException(String promptId, String message) {
        super(message, "openai", 404, "404", ErrorCategory.PERMANENT_UPSTREAM);
        this.promptId = promptId;
    }

    public String getPromptId() {
        return promptId;
    }
}
