package com.example.webhook;

/**
 * Minimal metrics hook for webhook delivery. Default is no-op.
 */
public interface DeliveryMetrics {
    void observeRequestLatencySeconds(double seconds);

    void incAttempt();

    void incDelivered();

    void incRetry();

    void incGiveUp();

    void incCancelled();

    static DeliveryMetrics noop() {
        return new DeliveryMetrics() {
            public void observeRequestLatencySeconds(double seconds) {
            }

            public void incAttempt() {
            }

            public void incDelivered() {
            }

            public void incRetry() {
            }

            public void incGiveUp() {
            }

            public void incCancelled() {
            }
        };
    }
}
