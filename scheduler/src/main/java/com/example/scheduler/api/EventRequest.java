package com.example.scheduler.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventRequest {
    private String expression; // cron expression, format set by SCHEDULER_CRON_TYPE
    private String url;
    private Integer maxRetries;
    private Long retryTimeoutSeconds;

    public EventRequest() {
    }

    public EventRequest(String expression, String url, Integer maxRetries, Long retryTimeoutSeconds) {
        this.expression = expression;
        this.url = url;
        this.maxRetries = maxRetries;
        this.retryTimeoutSeconds = retryTimeoutSeconds;
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
}
