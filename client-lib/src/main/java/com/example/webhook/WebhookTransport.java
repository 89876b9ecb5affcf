package com.example.webhook;

/**
 * Blocking outbound notification. Implementations report failures through the
 * returned {@link DeliveryResult} instead of throwing.
 */
@FunctionalInterface
public interface WebhookTransport {
    DeliveryResult get(String url);
}
