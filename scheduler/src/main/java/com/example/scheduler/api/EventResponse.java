package com.example.scheduler.api;

import com.example.scheduler.model.Event;
import com.example.scheduler.registry.Trigger;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventResponse {
    private Long id;
    private String expression;
    private String url;
    private Integer maxRetries;
    private Long retryTimeoutSeconds;
    private Boolean scheduled;
    private Instant nextRunAt;
    private Instant createdAt;
    private Instant updatedAt;

    public EventResponse() {
    }

    public EventResponse(Long id, String expression, String url, Integer maxRetries, Long retryTimeoutSeconds,
                         Boolean scheduled, Instant nextRunAt, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.expression = expression;
        this.url = url;
        this.maxRetries = maxRetries;
        this.retryTimeoutSeconds = retryTimeoutSeconds;
        this.scheduled = scheduled;
        this.nextRunAt = nextRunAt;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * @param trigger live trigger for the event, or null when it is not scheduled
     */
    public static EventResponse of(Event event, Trigger trigger) {
        boolean live = trigger != null && !trigger.isStopped();
        Instant next = live ? trigger.getNextExecution().orElse(null) : null;
        return new EventResponse(event.getId(), event.getExpression(), event.getUrl(), event.getMaxRetries(),
                event.getRetryTimeoutSeconds(), live, next, event.getCreatedAt(), event.getUpdatedAt());
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Long getRetryTimeoutSeconds() {
        return retryTimeoutSeconds;
    }

    public void setRetryTimeoutSeconds(Long retryTimeoutSeconds) {
        this.retryTimeoutSeconds = retryTimeoutSeconds;
    }

    public Boolean getScheduled() {
        return scheduled;
    }

    public void setScheduled(Boolean scheduled) {
        this.scheduled = scheduled;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
