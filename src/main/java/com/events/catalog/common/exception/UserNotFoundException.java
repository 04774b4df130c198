package com.events.catalog.common.exception;

public class UserNotFoundException extends BusinessException {

    public UserNotFoundException(String message) {
        super(ErrorCode.USER_NOT_FOUND, message);
    }
}
