package com.phillippitts.callintel.service.retry;

/**
 * Implemented by failures that carry a machine-readable error code (an HTTP status as a
 * string, or a network code such as {@code ETIMEDOUT}). Token-based retry predicates match
 * the code exactly instead of searching the message.
 */
public interface ClassifiedFailure {

    /**
     * @return the error code, or null when the failure has none
     */
    String getErrorCode();
}
