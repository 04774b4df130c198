package com.events.catalog.common.exception;

public class DuplicateRegistrationException extends BusinessException {

    public DuplicateRegistrationException(String message) {
        super(ErrorCode.DUPLICATE_REGISTRATION, message);
    }
}
