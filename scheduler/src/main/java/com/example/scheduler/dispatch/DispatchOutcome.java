package com.example.scheduler.dispatch;

/**
 * How a single dispatch run ended.
 */
public enum DispatchOutcome {
    DELIVERED,
    GAVE_UP,
    CANCELLED
}
