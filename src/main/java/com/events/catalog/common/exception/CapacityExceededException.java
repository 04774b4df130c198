package com.events.catalog.common.exception;

public class CapacityExceededException extends BusinessException {

    public CapacityExceededException(String message) {
        super(ErrorCode.CAPACITY_EXCEEDED, message);
    }
}
