package com.example.scheduler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A recurring webhook: GET {@code url} on every tick of {@code expression},
 * retrying up to {@code maxRetries} times, {@code retryTimeoutSeconds} apart.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {
    private long id;
    private String expression;
    private String url;
    private int maxRetries;
    private long retryTimeoutSeconds;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public RetryPolicy getRetryPolicy() {
        return new RetryPolicy(maxRetries, Duration.ofSeconds(retryTimeoutSeconds));
    }

    public Event copy() {
        return toBuilder().build();
    }
}
