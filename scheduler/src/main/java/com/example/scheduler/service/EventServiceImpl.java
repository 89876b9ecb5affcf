package com.example.scheduler.service;

import com.example.scheduler.api.EventRequest;
import com.example.scheduler.api.EventResponse;
import com.example.scheduler.engine.TimerEngine;
import com.example.scheduler.exception.EventNotFoundException;
import com.example.scheduler.exception.InvalidScheduleException;
import com.example.scheduler.exception.StoreUnavailableException;
import com.example.scheduler.model.Event;
import com.example.scheduler.model.EventQuery;
import com.example.scheduler.registry.EventRegistry;
import com.example.scheduler.registry.Trigger;
import com.example.scheduler.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps the store and the registry in step: persist then schedule, unschedule then remove.
 */
@RequiredArgsConstructor
@Slf4j
public class EventServiceImpl implements EventService {

    private final EventStore store;
    private final EventRegistry registry;
    private final TimerEngine engine;

    @Override
    public EventResponse createEvent(EventRequest request) {
        Event event = toEvent(0L, request);
        engine.validate(event.getExpression());
        Event saved = store.save(event);
        try {
            Trigger trigger = registry.create(saved);
            return EventResponse.of(saved, trigger);
        } catch (InvalidScheduleException | IllegalArgumentException e) {
            store.delete(saved.getId());
            throw e;
        }
    }

    @Override
    public EventResponse getEvent(long id) {
        Event event = store.findById(id).orElseThrow(() -> new EventNotFoundException(id));
        return EventResponse.of(event, findTrigger(id));
    }

    @Override
    public List<EventResponse> listEvents(EventQuery query) {
        return store.findEvents(query).stream()
                .map(e -> EventResponse.of(e, findTrigger(e.getId())))
                .collect(Collectors.toList());
    }

    @Override
    public EventResponse updateEvent(long id, EventRequest request) {
        Event existing = store.findById(id).orElseThrow(() -> new EventNotFoundException(id));
        Event event = toEvent(id, request);
        engine.validate(event.getExpression());
        event.setCreatedAt(existing.getCreatedAt());
        // the trigger is swapped only once the new row is stored
        Event saved = store.save(event);
        try {
            Trigger trigger = registry.update(saved);
            return EventResponse.of(saved, trigger);
        } catch (RuntimeException e) {
            restore(existing, e);
            throw e;
        }
    }

    private void restore(Event previous, RuntimeException cause) {
        try {
            store.save(previous);
        } catch (StoreUnavailableException re) {
            log.error("Event {} could not be restored after failed reschedule", previous.getId(), re);
            cause.addSuppressed(re);
        }
    }

    @Override
    public void deleteEvent(long id) {
        try {
            registry.delete(id);
        } catch (EventNotFoundException e) {
            // stored but never scheduled still gets removed
            if (!store.delete(id)) {
                throw e;
            }
            log.warn("Event {} was stored but not scheduled", id);
            return;
        }
        store.delete(id);
    }

    private Trigger findTrigger(long id) {
        try {
            return registry.find(id);
        } catch (EventNotFoundException e) {
            return null;
        }
    }

    private static Event toEvent(long id, EventRequest req) {
        if (req == null) {
            throw new IllegalArgumentException("request body is required");
        }
        if (req.getExpression() == null || req.getExpression().isBlank()) {
            throw new IllegalArgumentException("expression is required");
        }
        if (req.getUrl() == null || req.getUrl().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        String url = req.getUrl().trim();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("url is not valid: " + url);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("url must be http or https: " + url);
        }
        int maxRetries = req.getMaxRetries() == null ? 0 : req.getMaxRetries();
        long retryTimeout = req.getRetryTimeoutSeconds() == null ? 0L : req.getRetryTimeoutSeconds();
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryTimeout < 0) {
            throw new IllegalArgumentException("retryTimeoutSeconds must be >= 0");
        }
        return Event.builder()
                .id(id)
                .expression(req.getExpression().trim())
                .url(url)
                .maxRetries(maxRetries)
                .retryTimeoutSeconds(retryTimeout)
                .build();
    }
}
