package com.phillippitts.callintel.service.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable retry policy for a single call site.
 *
 * <p>The operation runs at most {@code maxRetries + 1} times. The raw delay before retry
 * number {@code n} (1-based) is {@code min(maxDelay, baseDelay * backoffMultiplier^(n-1))};
 * {@link RetryExecutor} applies jitter on top of it.
 *
 * @param maxRetries        retries after the first attempt (0 = no retry)
 * @param baseDelay         delay before the first retry
 * @param maxDelay          upper bound for any single delay
 * @param backoffMultiplier growth factor per retry (at least 1.0)
 * @param retryable         decides whether a failure may be retried; null accepts everything
 */
public record RetryConfig(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        Predicate<Throwable> retryable
) {

    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
        }
        if (retryable == null) {
            retryable = RetryPredicates.anyError();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    /**
     * Raw (un-jittered) delay before the given retry.
     *
     * @param retryNumber 1 for the delay after the first failed attempt
     * @return delay in milliseconds, never above {@link #maxDelay()}
     */
    public long delayMillisBeforeRetry(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("retryNumber must be >= 1, got: " + retryNumber);
        }
        double raw = baseDelay.toMillis() * Math.pow(backoffMultiplier, retryNumber - 1);
        return (long) Math.min(maxDelay.toMillis(), raw);
    }

    public static final class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private Predicate<Throwable> retryable;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder retryable(Predicate<Throwable> retryable) {
            this.retryable = retryable;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(maxRetries, baseDelay, maxDelay, backoffMultiplier, retryable);
        }
    }
}
