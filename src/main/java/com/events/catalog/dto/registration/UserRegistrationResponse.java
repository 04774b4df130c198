package com.events.catalog.dto.registration;

import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;

import java.time.LocalDateTime;

public record UserRegistrationResponse(
        Long eventId,
        RegistrationStatus status,
        LocalDateTime registeredAt
) {
    public static UserRegistrationResponse from(Registration registration) {
        return new UserRegistrationResponse(
                registration.getEventId(),
                registration.getStatus(),
                registration.getRegisteredAt()
        );
    }
}
