package com.example.scheduler.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded linear backoff: at most {@code maxRetries} extra attempts, {@code retryTimeout} apart.
 */
public final class RetryPolicy {
    private final int maxRetries;
    private final Duration retryTimeout;

    public RetryPolicy(int maxRetries, Duration retryTimeout) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryTimeout == null || retryTimeout.isNegative()) {
            throw new IllegalArgumentException("retryTimeout must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.retryTimeout = retryTimeout;
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(0, Duration.ZERO);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryTimeout() {
        return retryTimeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RetryPolicy))
            return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxRetries == that.maxRetries && retryTimeout.equals(that.retryTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, retryTimeout);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", retryTimeout=" + retryTimeout + "}";
    }
}
