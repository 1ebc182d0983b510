package com.phillippitts.callintel.exception;

/**
 * Classification assigned to an upstream failure at the boundary where it is first observed.
 * Retry predicates prefer this tag or the error code; message text is only consulted for
 * failures that carry neither.
 */
public enum ErrorCategory {

    /** Missing or rejected credential, missing model. Fatal, surfaced to the operator. */
    CONFIGURATION,

    /** Timeouts, 429 and 5xx responses. Recoverable by backoff. */
    TRANSIENT_UPSTREAM,

    /** Malformed responses, 4xx client errors. Fatal for the current attempt. */
    PERMANENT_UPSTREAM,

    /** The resource exists upstream but is not downloadable yet (e.g. a fresh recording). */
    NOT_YET_AVAILABLE
}
