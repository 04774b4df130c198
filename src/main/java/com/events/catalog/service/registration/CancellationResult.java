package com.events.catalog.service.registration;

import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;

/**
 * @param promotedUserId 승격된 대기자, 없으면 {@code null}
 */
public record CancellationResult(
        Long userId,
        Long eventId,
        RegistrationStatus cancelledStatus,
        Long promotedUserId
) {
    public static CancellationResult withoutPromotion(Registration cancelled) {
        return new CancellationResult(cancelled.getUserId(), cancelled.getEventId(), cancelled.getStatus(), null);
    }
}
