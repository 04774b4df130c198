package com.events.catalog.common.exception;

/**
 * 경합으로 재시도 한도를 넘겼을 때. 정상적인 비즈니스 거절이 아니라 운영상 이상 신호이므로 5xx로 응답한다.
 * 호출자는 다시 시도해도 된다.
 */
public class TransientConflictException extends BusinessException {

    public TransientConflictException(String message) {
        super(ErrorCode.TRANSIENT_CONFLICT, message);
    }
}
