package com.events.catalog.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 응답 본문의 {@code code} 값과 HTTP 상태의 짝.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    EVENT_NOT_FOUND(HttpStatus.NOT_FOUND, "이벤트를 찾을 수 없습니다."),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "사용자를 찾을 수 없습니다."),
    REGISTRATION_NOT_FOUND(HttpStatus.NOT_FOUND, "등록 정보를 찾을 수 없습니다."),

    DUPLICATE_REGISTRATION(HttpStatus.CONFLICT, "이미 등록된 이벤트입니다."),
    CAPACITY_EXCEEDED(HttpStatus.CONFLICT, "정원이 마감되었습니다."),
    DUPLICATE_EMAIL(HttpStatus.CONFLICT, "이미 사용 중인 이메일입니다."),

    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY, "유효성 검증 실패"),

    // 재시도 가능한 경합. 비즈니스 거절이 아니므로 5xx
    TRANSIENT_CONFLICT(HttpStatus.INTERNAL_SERVER_ERROR, "요청이 몰려 처리하지 못했습니다. 다시 시도해주세요."),
    STORE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "저장소 처리 중 오류가 발생했습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다.");

    private final HttpStatus httpStatus;
    private final String defaultMessage;

    public boolean isServerError() {
        return httpStatus.is5xxServerError();
    }
}
