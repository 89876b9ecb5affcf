package com.example.scheduler.dispatch;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared by every dispatch run of a trigger.
 */
public final class CancellationToken {
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for {@code delay} or until cancelled, whichever comes first.
     *
     * @return true if the token was cancelled
     */
    public boolean await(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return isCancelled();
        }
        return cancelled.await(toNanosSaturated(delay), TimeUnit.NANOSECONDS);
    }

    // delays beyond the nanosecond range wait until cancelled
    static long toNanosSaturated(Duration delay) {
        if (delay.compareTo(MAX_NANOS) >= 0) {
            return Long.MAX_VALUE;
        }
        return delay.toNanos();
    }
}
