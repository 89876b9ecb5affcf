package com.example.scheduler.service;

import com.example.scheduler.api.EventRequest;
import com.example.scheduler.api.EventResponse;
import com.example.scheduler.model.EventQuery;

import java.util.List;

public interface EventService {
    EventResponse createEvent(EventRequest request);

    EventResponse getEvent(long id);

    List<EventResponse> listEvents(EventQuery query);

    EventResponse updateEvent(long id, EventRequest request);

    void deleteEvent(long id);
}
