package com.phillippitts.callintel.service.retry;

/**
 * Outcome of {@link RetryExecutor#executeWithRetry}.
 *
 * @param success       true when one attempt returned normally
 * @param value         the returned value (null on failure)
 * @param error         the last failure (null on success)
 * @param attempts      number of attempts made, including the successful one
 * @param elapsedMillis wall-clock time spent, including backoff sleeps
 * @param <T>           value type
 */
public record RetryResult<T>(
        boolean success,
        T value,
        Throwable error,
        int attempts,
        long elapsedMillis
) {

    public static <T> RetryResult<T> success(T value, int attempts, long elapsedMillis) {
        return new RetryResult<>(true, value, null, attempts, elapsedMillis);
    }

    public static <T> RetryResult<T> failure(Throwable error, int attempts, long elapsedMillis) {
        return new RetryResult<>(false, null, error, attempts, elapsedMillis);
    }

    /**
     * @return the last error's message, or its class name when it has none; null on success
     */
    public String errorMessage() {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
