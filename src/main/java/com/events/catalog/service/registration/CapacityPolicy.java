package com.events.catalog.service.registration;

import org.springframework.stereotype.Component;

/**
 * 새 등록 시도의 결과를 정한다. I/O가 없는 순수 함수라서 재시도 루프 안에서 몇 번이고 다시 호출해도 된다.
 */
@Component
public class CapacityPolicy {

    public CapacityDecision decide(long confirmedCount, int capacity, boolean hasWaitlist) {
        if (confirmedCount < capacity) {
            return CapacityDecision.CONFIRM;
        }
        return hasWaitlist ? CapacityDecision.WAITLIST : CapacityDecision.REJECT;
    }
}
