package com.example.scheduler.registry;

import com.example.scheduler.model.Event;
import com.example.scheduler.store.EventStore;

import java.util.List;

/**
 * Maps event ids to live triggers.
 */
public interface EventRegistry {
    /**
     * Schedule an event. An existing trigger for the same id is stopped and replaced.
     *
     * @throws com.example.scheduler.exception.InvalidScheduleException if the expression is rejected;
     *         the registry is left unchanged
     * @throws IllegalArgumentException if the event is malformed
     */
    Trigger create(Event event);

    /**
     * Replace the trigger of an existing event.
     *
     * @throws com.example.scheduler.exception.EventNotFoundException if no trigger exists for the id
     * @throws com.example.scheduler.exception.InvalidScheduleException if the new expression is rejected;
     *         the old trigger stays live
     */
    Trigger update(Event event);

    /**
     * Stop and remove a trigger. No firing starts after this returns and in-flight
     * retry sequences are cancelled.
     *
     * @throws com.example.scheduler.exception.EventNotFoundException if no trigger exists for the id
     */
    void delete(long id);

    /**
     * @throws com.example.scheduler.exception.EventNotFoundException if no trigger exists for the id
     */
    Trigger find(long id);

    /**
     * Create a trigger for every stored event, stopping at the first failure.
     *
     * @throws com.example.scheduler.exception.StoreUnavailableException if the store query fails
     */
    void scheduleAll(EventStore store);

    List<Long> scheduledIds();

    int size();

    /** Stop and remove every trigger. */
    void clear();
}
