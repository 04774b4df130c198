package com.events.catalog.service.registration;

import com.events.catalog.domain.Registration;

public record CreateResult(
        CreateOutcome outcome,
        Registration registration
) {
    public static CreateResult created(Registration registration) {
        return new CreateResult(CreateOutcome.CREATED, registration);
    }

    public static CreateResult failed(CreateOutcome outcome) {
        return new CreateResult(outcome, null);
    }
}
