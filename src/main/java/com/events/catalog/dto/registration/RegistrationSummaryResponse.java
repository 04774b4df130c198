package com.events.catalog.dto.registration;

public record RegistrationSummaryResponse(
        Long eventId,
        int capacity,
        boolean hasWaitlist,
        long confirmedCount,
        long waitlistedCount,
        long remainingSeats
) {
}
