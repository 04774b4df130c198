package com.events.catalog.common.exception;

public class EventNotFoundException extends BusinessException {

    public EventNotFoundException(String message) {
        super(ErrorCode.EVENT_NOT_FOUND, message);
    }
}
