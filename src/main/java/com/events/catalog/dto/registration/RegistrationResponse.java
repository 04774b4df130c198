package com.events.catalog.dto.registration;

import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;

import java.time.LocalDateTime;

public record RegistrationResponse(
        Long userId,
        Long eventId,
        RegistrationStatus status,
        LocalDateTime registeredAt
) {
    public static RegistrationResponse from(Registration registration) {
        return new RegistrationResponse(
                registration.getUserId(),
                registration.getEventId(),
                registration.getStatus(),
                registration.getRegisteredAt()
        );
    }
}
