package com.events.catalog.domain;

public enum RegistrationStatus {
    CONFIRMED, WAITLISTED
}
