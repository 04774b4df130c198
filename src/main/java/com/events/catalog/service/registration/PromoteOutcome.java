package com.events.catalog.service.registration;

public enum PromoteOutcome {
    PROMOTED, NOT_FOUND, ALREADY_CONFIRMED
}
