package com.events.catalog.service.registration;

public enum CreateOutcome {
    CREATED,
    // (userId, eventId) 레코드가 이미 있음
    ALREADY_EXISTS,
    // 같은 슬롯을 다른 요청이 먼저 확정함 → 정원이 바뀌었으니 다시 판단
    SLOT_TAKEN
}
