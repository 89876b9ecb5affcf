package com.example.scheduler.store;

import com.example.scheduler.model.Event;
import com.example.scheduler.model.EventQuery;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryEventStore implements EventStore {
    private final Map<Long, Event> events = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong();

    @Override
    public List<Event> findEvents(EventQuery query) {
        EventQuery q = (query == null ? new EventQuery() : query);
        return events.values().stream()
                .filter(q::matches)
                .sorted(Comparator.comparingLong(Event::getId))
                .map(Event::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Event> findById(long id) {
        return Optional.ofNullable(events.get(id)).map(Event::copy);
    }

    @Override
    public Event save(Event event) {
        Event toSave = event.copy();
        Instant now = Instant.now();
        if (toSave.getId() == 0) {
            toSave.setId(seq.incrementAndGet());
        } else {
            seq.accumulateAndGet(toSave.getId(), Math::max);
        }
        Event existing = events.get(toSave.getId());
        toSave.setCreatedAt(existing != null ? existing.getCreatedAt() : now);
        toSave.setUpdatedAt(now);
        events.put(toSave.getId(), toSave);
        return toSave.copy();
    }

    @Override
    public boolean delete(long id) {
        return events.remove(id) != null;
    }
}
