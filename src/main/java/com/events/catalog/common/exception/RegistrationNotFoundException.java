package com.events.catalog.common.exception;

public class RegistrationNotFoundException extends BusinessException {

    public RegistrationNotFoundException(String message) {
        super(ErrorCode.REGISTRATION_NOT_FOUND, message);
    }
}
