package com.events.catalog.common.exception;

public class DuplicateEmailException extends BusinessException {

    public DuplicateEmailException(String message) {
        super(ErrorCode.DUPLICATE_EMAIL, message);
    }
}
