package com.example.scheduler.engine;

import com.example.scheduler.exception.InvalidScheduleException;

/**
 * Runs callbacks at each wall-clock instant matching a cron-style expression.
 */
public interface TimerEngine {
    /**
     * Begin processing ticks. Entries scheduled earlier start ticking now.
     */
    void start();

    /**
     * Register a callback for an expression.
     *
     * @return handle that stops this one registration
     * @throws InvalidScheduleException if the expression is rejected
     */
    CronEntry schedule(String expression, Runnable callback);

    /**
     * Check an expression without registering anything.
     *
     * @throws InvalidScheduleException if the expression is rejected
     */
    void validate(String expression);

    /**
     * Stop every entry and release the engine's threads.
     */
    void stop();
}
