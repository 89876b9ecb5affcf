package com.example.webhook;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * WebhookTransport over java.net.http.
 * Any HTTP response counts as delivered; the status code is kept for diagnostics.
 * Connection errors, timeouts and bad URLs are reported as failed results.
 */
@Slf4j
public class WebhookClient implements WebhookTransport {
    private final HttpClient http;
    private final Duration requestTimeout;
    private final DeliveryMetrics metrics;

    public WebhookClient(Duration requestTimeout) {
        this(requestTimeout, DeliveryMetrics.noop());
    }

    public WebhookClient(Duration requestTimeout, DeliveryMetrics metrics) {
        this(HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), requestTimeout, metrics);
    }

    public WebhookClient(HttpClient http, Duration requestTimeout, DeliveryMetrics metrics) {
        this.http = http;
        this.requestTimeout = requestTimeout;
        this.metrics = (metrics == null ? DeliveryMetrics.noop() : metrics);
    }

    @Override
    public DeliveryResult get(String url) {
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            return DeliveryResult.failed("invalid url: " + url);
        }

        long t0 = System.nanoTime();
        try {
            HttpResponse<Void> resp = http.send(req, HttpResponse.BodyHandlers.discarding());
            log.debug("GET {} -> {}", url, resp.statusCode());
            return DeliveryResult.delivered(resp.statusCode());
        } catch (IOException e) {
            log.debug("GET {} failed: {}", url, e.toString());
            return DeliveryResult.failed(e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failed("interrupted");
        } finally {
            metrics.observeRequestLatencySeconds((System.nanoTime() - t0) / 1_000_000_000.0);
        }
    }
}
