package com.events.catalog.dto.event;

import com.events.catalog.domain.Event;
import com.events.catalog.domain.EventStatus;

import java.time.LocalDate;

public record EventResponse(
        Long id,
        String title,
        String description,
        LocalDate eventDate,
        String location,
        int capacity,
        String organizer,
        EventStatus status,
        boolean hasWaitlist
) {
    public static EventResponse from(Event event) {
        return new EventResponse(
                event.getId(),
                event.getTitle(),
                event.getDescription(),
                event.getEventDate(),
                event.getLocation(),
                event.getCapacity(),
                event.getOrganizer(),
                event.getStatus(),
                event.isHasWaitlist()
        );
    }
}
