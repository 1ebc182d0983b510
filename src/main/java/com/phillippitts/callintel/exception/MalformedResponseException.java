package com.phillippitts.callintel.exception;

/**
 * Thrown when a reasoning-service response has no usable text or the text is not valid JSON.
 * A malformed response will not become well-formed on retry, so this is always permanent.
 */
public class MalformedResponseException extends UpstreamException {

    public static final String ERROR_CODE = "EMALFORMED";

    private final String responseId;

    public MalformedResponseException(String message, String responseId) {
        super(message, "openai", 0, ERROR_CODE, ErrorCategory.PERMANENT_UPSTREAM);
        this.responseId = responseId;
    }

    public MalformedResponseException(String message, String responseId, Throwable cause) {
        super(message, "openai", 0, ERROR_CODE, ErrorCategory.PERMANENT_UPSTREAM, cause);
        this.responseId = responseId;
    }

    public String getResponseId() {
        return responseId;
    }
}
