package com.events.catalog.service.registration;

import java.util.Optional;

public interface EventLookup {

    Optional<EventCapacity> lookup(Long eventId);
}
