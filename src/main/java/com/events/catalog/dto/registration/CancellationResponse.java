package com.events.catalog.dto.registration;

import com.events.catalog.domain.RegistrationStatus;
import com.events.catalog.service.registration.CancellationResult;

public record CancellationResponse(
        Long userId,
        Long eventId,
        RegistrationStatus cancelledStatus,
        Long promotedUserId
) {
    public static CancellationResponse from(CancellationResult result) {
        return new CancellationResponse(
                result.userId(),
                result.eventId(),
                result.cancelledStatus(),
                result.promotedUserId()
        );
    }
}
