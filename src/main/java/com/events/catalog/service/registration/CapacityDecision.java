package com.events.catalog.service.registration;

public enum CapacityDecision {
    CONFIRM, WAITLIST, REJECT
}
