package com.example.scheduler.exception;

public class EventNotFoundException extends RuntimeException {
    private final long eventId;

    public EventNotFoundException(long eventId) {
        super("Event with id " + eventId + " not found");
        this.eventId = eventId;
    }

    public long getEventId() {
        return eventId;
    }
}
