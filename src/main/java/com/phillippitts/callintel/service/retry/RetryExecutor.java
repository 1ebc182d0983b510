package com.phillippitts.callintel.service.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

/**
 * Generic exponential-backoff-with-jitter executor.
 *
 * <p>Knows nothing about call records or upstream services: the caller supplies the
 * operation, a {@link RetryConfig} and a label used only for logging. The executor keeps
 * no state between invocations, so one instance is shared by all pipeline stages.
 *
 * <p><b>Jitter:</b> each raw delay from {@link RetryConfig#delayMillisBeforeRetry(int)} is
 * scaled by a uniform factor in [0.9, 1.1] and floored at zero.
 *
 * <p><b>Threading:</b> backoff sleeps suspend only the calling task. {@link #withTimeout}
 * runs the operation on the supplied executor so the caller can stop waiting for it. An
 * interrupt of the calling thread ends the loop at once with the interrupt flag restored.
 */
public class RetryExecutor {

    private static final Logger LOG = LogManager.getLogger(RetryExecutor.class);

    static final double JITTER_RATIO = 0.10;

    private final Executor timeoutExecutor;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryExecutor(Executor timeoutExecutor) {
        this(timeoutExecutor, Sleeper.threadSleep(), () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param timeoutExecutor executor that runs operations guarded by {@link #withTimeout}
     * @param sleeper         suspends between attempts
     * @param random          source of uniform values in [0, 1) for jitter
     */
    public RetryExecutor(Executor timeoutExecutor, Sleeper sleeper, DoubleSupplier random) {
        this.timeoutExecutor = Objects.requireNonNull(timeoutExecutor, "timeoutExecutor");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Runs the operation until it succeeds, fails with a non-retryable error, or the
     * attempt budget is spent. Never throws for operation failures; they are reported in
     * the returned {@link RetryResult}.
     *
     * @param operation work to attempt
     * @param config    retry policy
     * @param label     short description for logs
     * @return outcome with attempt count and elapsed time
     */
    public <T> RetryResult<T> executeWithRetry(Callable<T> operation, RetryConfig config, String label) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        long startNanos = System.nanoTime();
        int maxAttempts = config.maxAttempts();
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                T value = operation.call();
                if (attempt > 1) {
                    LOG.info("{} succeeded on attempt {}/{}", label, attempt, maxAttempts);
                }
                return RetryResult.success(value, attempt, elapsedMillis(startNanos));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("{} interrupted on attempt {}/{}; giving up", label, attempt, maxAttempts);
                return RetryResult.failure(e, attempt, elapsedMillis(startNanos));
            } catch (Exception e) {
                lastError = e;
                if (!config.isRetryable(e)) {
                    LOG.warn("{} failed with non-retryable error on attempt {}/{}: {}",
                            label, attempt, maxAttempts, e.getMessage());
                    return RetryResult.failure(e, attempt, elapsedMillis(startNanos));
                }
                if (attempt == maxAttempts) {
                    break;
                }
                long delayMs = jitteredDelayMillis(config, attempt);
                LOG.info("{} attempt {}/{} failed ({}); retrying in {} ms",
                        label, attempt, maxAttempts, e.getMessage(), delayMs);
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    LOG.warn("{} interrupted while backing off; giving up after {} attempt(s)", label, attempt);
                    return RetryResult.failure(e, attempt, elapsedMillis(startNanos));
                }
            }
        }

        LOG.warn("{} exhausted {} attempt(s): {}", label, maxAttempts,
                lastError == null ? "unknown error" : lastError.getMessage());
        return RetryResult.failure(lastError, maxAttempts, elapsedMillis(startNanos));
    }

    /**
     * Same as {@link #executeWithRetry} but every attempt is individually bounded by
     * {@link #withTimeout}. Whether a timed-out attempt is retried is up to the config.
     */
    public <T> RetryResult<T> executeWithRetryAndTimeout(Callable<T> operation, RetryConfig config,
                                                         Duration attemptTimeout, String label) {
        return executeWithRetry(() -> withTimeout(operation, attemptTimeout, label), config, label);
    }

    /**
     * Races the operation against a timer. On timeout the task is cancelled, which interrupts
     * the thread running it.
     *
     * @return the operation's value if it finishes in time
     * @throws OperationTimeoutException if the timeout elapses first
     * @throws InterruptedException if the calling thread is interrupted while waiting; the
     *         task is cancelled and the interrupt is left to the caller
     * @throws Exception whatever the operation itself threw
     */
    public <T> T withTimeout(Callable<T> operation, Duration timeout, String label) throws Exception {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(timeout, "timeout");
        FutureTask<T> task = new FutureTask<>(operation);
        timeoutExecutor.execute(task);

        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            task.cancel(true);
            throw new OperationTimeoutException(label, timeout);
        } catch (InterruptedException ie) {
            task.cancel(true);
            throw ie;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw ee;
        }
    }

    long jitteredDelayMillis(RetryConfig config, int retryNumber) {
        long raw = config.delayMillisBeforeRetry(retryNumber);
        double factor = 1.0 + JITTER_RATIO * (2.0 * random.getAsDouble() - 1.0);
        return Math.max(0L, Math.round(raw * factor));
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
