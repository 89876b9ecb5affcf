package com.example.scheduler.registry;

import com.example.scheduler.dispatch.CancellationToken;
import com.example.scheduler.engine.CronEntry;
import com.example.scheduler.model.Event;

import java.time.Instant;
import java.util.Optional;

/**
 * Live binding between one event and its timer-engine entry. Only the registry
 * creates and stops triggers.
 */
public final class Trigger {
    private final Event event;
    private final CronEntry entry;
    private final CancellationToken token;
    private final Instant scheduledAt;

    Trigger(Event event, CronEntry entry, CancellationToken token) {
        this.event = event;
        this.entry = entry;
        this.token = token;
        this.scheduledAt = Instant.now();
    }

    public long getEventId() {
        return event.getId();
    }

    /** Snapshot of the event this trigger was built from. */
    public Event getEvent() {
        return event.copy();
    }

    public String getExpression() {
        return entry.expression();
    }

    public Optional<Instant> getNextExecution() {
        return entry.nextExecution();
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public boolean isStopped() {
        return entry.isStopped();
    }

    void stop() {
        entry.stop();
        token.cancel();
    }

    @Override
    public String toString() {
        return "Trigger{eventId=" + event.getId() + ", expression=" + entry.expression() + ", stopped="
                + entry.isStopped() + "}";
    }
}
