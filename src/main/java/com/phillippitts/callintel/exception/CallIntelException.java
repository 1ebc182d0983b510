package com.phillippitts.callintel.exception;

/**
 * Base exception for all CallIntel application-specific errors.
 * All domain exceptions extend this class so pipeline stages can convert any of them
 * into a persisted failure message at a single catch site.
 */
public class CallIntelException extends RuntimeException {

    public CallIntelException(String message) {
        super(message);
    }

    public CallIntelException(String message, Throwable cause) {
        super(message, cause);
    }

    public CallIntelException(Throwable cause) {
        super(cause);
    }
}
