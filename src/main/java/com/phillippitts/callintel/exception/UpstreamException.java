package com.phillippitts.callintel.exception;

import com.phillippitts.callintel.service.retry.ClassifiedFailure;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Thrown when an external collaborator (speech-to-text or reasoning service) fails.
 *
 * <p>Carries the service name, the HTTP status when one was received (0 otherwise), a
 * machine-matchable error code (the status as a string, or a network code such as
 * {@code ETIMEDOUT}) and an {@link ErrorCategory}.
 */
public class UpstreamException extends CallIntelException implements ClassifiedFailure {

    private final String service;
    private final int statusCode;
    private final String errorCode;
    private final ErrorCategory category;

    public UpstreamException(String message, String service, int statusCode,
                             String errorCode, ErrorCategory category) {
        super(message);
        this.service = service;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.category = Objects.requireNonNull(category, "category");
    }

    public UpstreamException(String message, String service, int statusCode,
                             String errorCode, ErrorCategory category, Throwable cause) {
        super(message, cause);
        this.service = service;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.category = Objects.requireNonNull(category, "category");
    }

    public String getService() {
        return service;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * Retry predicate that accepts only upstream failures tagged with the given category.
     */
    public static Predicate<Throwable> hasCategory(ErrorCategory category) {
        return error -> error instanceof UpstreamException upstream && upstream.getCategory() == category;
    }
}
