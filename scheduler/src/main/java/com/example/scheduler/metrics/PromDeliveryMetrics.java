package com.example.scheduler.metrics;

import com.example.webhook.DeliveryMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import io.prometheus.client.hotspot.DefaultExports;

/**
 * Prometheus-backed implementation of DeliveryMetrics.
 */
public class PromDeliveryMetrics implements DeliveryMetrics {
    private final Counter attempts;
    private final Counter delivered;
    private final Counter retries;
    private final Counter giveUps;
    private final Counter cancelled;
    private final Histogram requestLatencySeconds;

    public PromDeliveryMetrics(CollectorRegistry registry) {
        // register default JVM metrics once
        DefaultExports.initialize();

        this.attempts = Counter.build()
                .name("webhook_attempts_total")
                .help("Total webhook delivery attempts")
                .register(registry);
        this.delivered = Counter.build()
                .name("webhook_delivered_total")
                .help("Total dispatch runs that delivered")
                .register(registry);
        this.retries = Counter.build()
                .name("webhook_retries_total")
                .help("Total retries scheduled after a failed attempt")
                .register(registry);
        this.giveUps = Counter.build()
                .name("webhook_give_ups_total")
                .help("Total dispatch runs that reached max retries")
                .register(registry);
        this.cancelled = Counter.build()
                .name("webhook_cancelled_total")
                .help("Total dispatch runs abandoned because their event was removed")
                .register(registry);
        this.requestLatencySeconds = Histogram.build()
                .name("webhook_request_latency_seconds")
                .help("Latency of webhook GET requests in seconds")
                .buckets(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0)
                .register(registry);
    }

    @Override
    public void observeRequestLatencySeconds(double seconds) {
        requestLatencySeconds.observe(seconds);
    }

    @Override
    public void incAttempt() {
        attempts.inc();
    }

    @Override
    public void incDelivered() {
        delivered.inc();
    }

    @Override
    public void incRetry() {
        retries.inc();
    }

    @Override
    public void incGiveUp() {
        giveUps.inc();
    }

    @Override
    public void incCancelled() {
        cancelled.inc();
    }
}
