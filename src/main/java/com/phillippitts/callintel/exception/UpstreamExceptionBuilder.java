package com.phillippitts.callintel.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link UpstreamException} with contextual details appended to the message.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw UpstreamExceptionBuilder.create("Responses API call failed")
 *         .service("openai")
 *         .status(503)
 *         .category(ErrorCategory.TRANSIENT_UPSTREAM)
 *         .metadata("promptId", promptId)
 *         .build();
 *
 * throw UpstreamExceptionBuilder.create("Recording download timed out")
 *         .service("recording")
 *         .errorCode("ETIMEDOUT")
 *         .category(ErrorCategory.TRANSIENT_UPSTREAM)
 *         .cause(ex)
 *         .build();
 * </pre>
 *
 * <p>When no explicit error code is given, a non-zero status is used as the code.
 */
public final class UpstreamExceptionBuilder {

    private final String message;
    private String service = "unknown";
    private int status;
    private String errorCode;
    private ErrorCategory category = ErrorCategory.PERMANENT_UPSTREAM;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private UpstreamExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static UpstreamExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new UpstreamExceptionBuilder(message);
    }

    public UpstreamExceptionBuilder service(String service) {
        this.service = service;
        return this;
    }

    public UpstreamExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public UpstreamExceptionBuilder errorCode(String errorCode) {
        this.errorCode = errorCode;
        return this;
    }

    public UpstreamExceptionBuilder category(ErrorCategory category) {
        this.category = category;
        return this;
    }

    public UpstreamExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public UpstreamExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (status={status}, {key1}={val1}, ...)
     * </pre>
     */
    public UpstreamException build() {
        String code = errorCode != null ? errorCode : (status > 0 ? String.valueOf(status) : null);
        String detailedMessage = buildDetailedMessage();
        if (cause != null) {
            return new UpstreamException(detailedMessage, service, status, code, category, cause);
        }
        return new UpstreamException(detailedMessage, service, status, code, category);
    }

    private String buildDetailedMessage() {
        if (status <= 0 && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (status > 0) {
            sb.append("status=").append(status);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
