package com.phillippitts.callintel.service.retry;

import java.time.Duration;

/**
 * Raised by {@link RetryExecutor#withTimeout} when an operation does not finish in time.
 *
 * <p>Timeouts are retried only when the caller's retry predicate explicitly accepts them.
 */
public class OperationTimeoutException extends RuntimeException implements ClassifiedFailure {

    public static final String ERROR_CODE = "ETIMEDOUT";

    private final Duration timeout;

    public OperationTimeoutException(String label, Duration timeout) {
        super(label + " timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
