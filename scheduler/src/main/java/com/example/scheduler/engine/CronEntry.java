package com.example.scheduler.engine;

import java.time.Instant;
import java.util.Optional;

/**
 * A single registration with a {@link TimerEngine}.
 */
public interface CronEntry {
    String expression();

    /** Next instant this entry will fire, empty once stopped. */
    Optional<Instant> nextExecution();

    /** Halt further ticks. Idempotent. */
    void stop();

    boolean isStopped();
}
