package com.example.scheduler.registry;

import com.example.scheduler.dispatch.CancellationToken;
import com.example.scheduler.dispatch.Dispatcher;
import com.example.scheduler.engine.CronEntry;
import com.example.scheduler.engine.TimerEngine;
import com.example.scheduler.exception.EventNotFoundException;
import com.example.scheduler.model.Event;
import com.example.scheduler.model.EventQuery;
import com.example.scheduler.model.RetryPolicy;
import com.example.scheduler.store.EventStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * EventRegistry that registers one {@link TimerEngine} entry per event and runs the
 * {@link Dispatcher} on every tick.
 *
 * All access to the id map goes through a single read/write lock. A replaced or
 * deleted trigger is stopped before the write lock is released.
 */
@Slf4j
public class CronEventRegistry implements EventRegistry {
    private final TimerEngine engine;
    private final Dispatcher dispatcher;
    private final Map<Long, Trigger> triggers = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public CronEventRegistry(TimerEngine engine, Dispatcher dispatcher) {
        this.engine = engine;
        this.dispatcher = dispatcher;
    }

    @Override
    public Trigger create(Event event) {
        validate(event);
        lock.writeLock().lock();
        try {
            return replace(event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Trigger update(Event event) {
        validate(event);
        lock.writeLock().lock();
        try {
            if (!triggers.containsKey(event.getId())) {
                throw new EventNotFoundException(event.getId());
            }
            return replace(event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(long id) {
        lock.writeLock().lock();
        try {
            Trigger trigger = triggers.get(id);
            if (trigger == null) {
                throw new EventNotFoundException(id);
            }
            trigger.stop();
            triggers.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Event {} unscheduled", id);
    }

    @Override
    public Trigger find(long id) {
        lock.readLock().lock();
        try {
            Trigger trigger = triggers.get(id);
            if (trigger == null) {
                throw new EventNotFoundException(id);
            }
            return trigger;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void scheduleAll(EventStore store) {
        List<Event> events = store.findEvents(new EventQuery());
        for (Event event : events) {
            create(event);
        }
        log.info("Scheduled {} stored events", events.size());
    }

    @Override
    public List<Long> scheduledIds() {
        lock.readLock().lock();
        try {
            List<Long> ids = new ArrayList<>(triggers.keySet());
            Collections.sort(ids);
            return ids;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return triggers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            for (Trigger t : triggers.values()) {
                t.stop();
            }
            triggers.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private Trigger replace(Event event) {
        Event snapshot = event.copy();
        Trigger created = schedule(snapshot);
        Trigger previous = triggers.put(snapshot.getId(), created);
        if (previous != null) {
            previous.stop();
            log.info("Event {} rescheduled with '{}'", snapshot.getId(), snapshot.getExpression());
        } else {
            log.info("Event {} scheduled with '{}'", snapshot.getId(), snapshot.getExpression());
        }
        return created;
    }

    private Trigger schedule(Event event) {
        long id = event.getId();
        String url = event.getUrl();
        RetryPolicy policy = event.getRetryPolicy();
        CancellationToken token = new CancellationToken();
        CronEntry entry = engine.schedule(event.getExpression(),
                () -> dispatcher.dispatch(id, url, policy, token));
        return new Trigger(event, entry, token);
    }

    private static void validate(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }
        if (event.getId() <= 0) {
            throw new IllegalArgumentException("event id must be positive, got " + event.getId());
        }
        if (event.getUrl() == null || event.getUrl().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (event.getMaxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (event.getRetryTimeoutSeconds() < 0) {
            throw new IllegalArgumentException("retryTimeoutSeconds must be >= 0");
        }
    }
}
