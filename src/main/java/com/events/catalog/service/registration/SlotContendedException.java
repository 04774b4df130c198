package com.events.catalog.service.registration;

/**
 * 확정 슬롯 삽입이 동시 요청에 밀렸을 때 등록 재시도 루프에 보내는 신호. HTTP 계층까지 나가지 않는다.
 */
public class SlotContendedException extends RuntimeException {

    public SlotContendedException(Long eventId, Integer slot) {
        super("슬롯 경합: eventId=" + eventId + ", slot=" + slot);
    }
}
