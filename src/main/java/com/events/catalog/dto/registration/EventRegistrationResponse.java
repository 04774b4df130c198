package com.events.catalog.dto.registration;

import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;

import java.time.LocalDateTime;

public record EventRegistrationResponse(
        Long userId,
        RegistrationStatus status,
        LocalDateTime registeredAt
) {
    public static EventRegistrationResponse from(Registration registration) {
        return new EventRegistrationResponse(
                registration.getUserId(),
                registration.getStatus(),
                registration.getRegisteredAt()
        );
    }
}
