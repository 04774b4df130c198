package com.events.catalog.service.registration;

public record EventCapacity(
        Long eventId,
        int capacity,
        boolean hasWaitlist
) {
}
