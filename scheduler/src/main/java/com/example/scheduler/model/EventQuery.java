package com.example.scheduler.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Store filter. Null fields match anything, so an empty query matches every event.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventQuery {
    private String expression;
    private String url;

    public boolean matches(Event event) {
        if (event == null)
            return false;
        if (expression != null && !expression.equals(event.getExpression()))
            return false;
        return url == null || url.equals(event.getUrl());
    }
}
