package com.example.scheduler.dispatch;

import com.example.scheduler.model.RetryPolicy;
import com.example.webhook.DeliveryMetrics;
import com.example.webhook.DeliveryResult;
import com.example.webhook.WebhookTransport;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes one dispatch run per timer firing: deliver, and on failure retry with a
 * fixed delay until the policy's retries are used up.
 *
 * Runs are independent. A run that is still retrying when the next firing arrives
 * keeps going next to the new one.
 */
@Slf4j
public class Dispatcher {
    private final WebhookTransport transport;
    private final DeliveryMetrics metrics;

    public Dispatcher(WebhookTransport transport) {
        this(transport, DeliveryMetrics.noop());
    }

    public Dispatcher(WebhookTransport transport, DeliveryMetrics metrics) {
        this.transport = transport;
        this.metrics = (metrics == null ? DeliveryMetrics.noop() : metrics);
    }

    public DispatchOutcome dispatch(long eventId, String url, RetryPolicy policy, CancellationToken token) {
        int retries = policy.getMaxRetries();
        int attempt = 0;
        while (true) {
            if (token.isCancelled()) {
                return cancelled(eventId, url, attempt);
            }
            attempt++;
            metrics.incAttempt();
            DeliveryResult result = attempt(url);
            if (result.isDelivered()) {
                metrics.incDelivered();
                log.info("Event {} sent to {} (status={}, attempt={})", eventId, url, result.getStatusCode(), attempt);
                return DispatchOutcome.DELIVERED;
            }

            if (retries == 0) {
                metrics.incGiveUp();
                log.warn("Event {} to {}: max retries reached after {} attempts, last error: {}",
                        eventId, url, attempt, result.getError());
                return DispatchOutcome.GAVE_UP;
            }

            log.info("Retrying event {} to {} in {}s (retries left={}, error={})",
                    eventId, url, policy.getRetryTimeout().getSeconds(), retries, result.getError());
            metrics.incRetry();
            try {
                if (token.await(policy.getRetryTimeout())) {
                    return cancelled(eventId, url, attempt);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(eventId, url, attempt);
            }
            retries--;
        }
    }

    private DeliveryResult attempt(String url) {
        try {
            DeliveryResult r = transport.get(url);
            return r == null ? DeliveryResult.failed("no result") : r;
        } catch (RuntimeException e) {
            return DeliveryResult.failed(e.toString());
        }
    }

    private DispatchOutcome cancelled(long eventId, String url, int attempts) {
        metrics.incCancelled();
        log.info("Dispatch of event {} to {} cancelled after {} attempts", eventId, url, attempts);
        return DispatchOutcome.CANCELLED;
    }
}
