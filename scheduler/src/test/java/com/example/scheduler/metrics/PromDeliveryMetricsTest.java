package com.example.scheduler.metrics;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.example.scheduler.dispatch.CancellationToken;
import com.example.scheduler.dispatch.DispatchOutcome;
import com.example.scheduler.dispatch.Dispatcher;
import com.example.scheduler.model.RetryPolicy;
import com.example.webhook.DeliveryResult;

import io.prometheus.client.CollectorRegistry;

public class PromDeliveryMetricsTest {

    private static double sample(CollectorRegistry registry, String name) {
        Double v = registry.getSampleValue(name);
        return v == null ? 0.0 : v;
    }

    @Test
    public void dispatchRunsAreCounted() {
        CollectorRegistry registry = new CollectorRegistry();
        PromDeliveryMetrics metrics = new PromDeliveryMetrics(registry);
        AtomicInteger calls = new AtomicInteger();
        Dispatcher dispatcher = new Dispatcher(url -> calls.incrementAndGet() < 3
                ? DeliveryResult.failed("connection refused")
                : DeliveryResult.delivered(200), metrics);

        DispatchOutcome ok = dispatcher.dispatch(1, "http://hook.local", new RetryPolicy(5, Duration.ZERO),
                new CancellationToken());
        DispatchOutcome second = dispatcher.dispatch(2, "http://hook.local", RetryPolicy.noRetries(),
                new CancellationToken());

        assertThat(ok, is(DispatchOutcome.DELIVERED));
        assertThat(second, is(DispatchOutcome.DELIVERED));
        assertThat(sample(registry, "webhook_attempts_total"), is(4.0));
        assertThat(sample(registry, "webhook_retries_total"), is(2.0));
        assertThat(sample(registry, "webhook_delivered_total"), is(2.0));
        assertThat(sample(registry, "webhook_give_ups_total"), is(0.0));
    }

    @Test
    public void giveUpsAndCancellationsAreCounted() {
        CollectorRegistry registry = new CollectorRegistry();
        PromDeliveryMetrics metrics = new PromDeliveryMetrics(registry);
        Dispatcher dispatcher = new Dispatcher(url -> DeliveryResult.failed("down"), metrics);
        CancellationToken cancelled = new CancellationToken();
        cancelled.cancel();

        dispatcher.dispatch(1, "http://hook.local", new RetryPolicy(1, Duration.ZERO), new CancellationToken());
        dispatcher.dispatch(2, "http://hook.local", new RetryPolicy(1, Duration.ZERO), cancelled);

        assertThat(sample(registry, "webhook_attempts_total"), is(2.0));
        assertThat(sample(registry, "webhook_give_ups_total"), is(1.0));
        assertThat(sample(registry, "webhook_cancelled_total"), is(1.0));
    }

    @Test
    public void latencyIsObserved() {
        CollectorRegistry registry = new CollectorRegistry();
        PromDeliveryMetrics metrics = new PromDeliveryMetrics(registry);

        metrics.observeRequestLatencySeconds(0.02);

        assertThat(sample(registry, "webhook_request_latency_seconds_count"), is(1.0));
    }
}
