package com.events.catalog.domain;

public enum EventStatus {
    ACTIVE, SCHEDULED, ONGOING, COMPLETED, CANCELLED
}
