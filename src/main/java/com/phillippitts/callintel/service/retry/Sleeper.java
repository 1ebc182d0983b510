package com.phillippitts.callintel.service.retry;

import java.time.Duration;

/**
 * Suspends the current task between attempts. Abstracted so tests can record delays
 * instead of waiting for them.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long)}. Interruptible, so a bounded wait
     * built on it can be cancelled.
     */
    static Sleeper threadSleep() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
