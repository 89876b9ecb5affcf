package com.example.scheduler.store;

import com.example.scheduler.model.Event;
import com.example.scheduler.model.EventQuery;

import java.util.List;
import java.util.Optional;

/**
 * Persisted events. Backend failures surface as
 * {@link com.example.scheduler.exception.StoreUnavailableException}.
 */
public interface EventStore {
    List<Event> findEvents(EventQuery query);

    Optional<Event> findById(long id);

    /**
     * Insert or overwrite. An event with id 0 gets a fresh id. Timestamps are set here.
     */
    Event save(Event event);

    boolean delete(long id);
}
