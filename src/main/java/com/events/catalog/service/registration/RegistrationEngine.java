package com.events.catalog.service.registration;

import com.events.catalog.common.exception.CapacityExceededException;
import com.events.catalog.common.exception.DuplicateRegistrationException;
import com.events.catalog.common.exception.EventNotFoundException;
import com.events.catalog.common.exception.TransientConflictException;
import com.events.catalog.common.exception.UserNotFoundException;
import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;
import com.events.catalog.dto.registration.CancellationResponse;
import com.events.catalog.dto.registration.EventRegistrationResponse;
import com.events.catalog.dto.registration.RegistrationResponse;
import com.events.catalog.dto.registration.RegistrationSummaryResponse;
import com.events.catalog.dto.registration.UserRegistrationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 등록/취소/조회 진입점.
 * <p>
 * 이벤트 단위 전역 락 대신 낙관적 재시도를 쓴다: 확정 슬롯을 읽고 → 정책으로 판단하고 → 조건부로 쓰고 →
 * 슬롯 경합이면 처음부터 다시. 최종 판단은 항상 쓰기 직전에 새로 읽은 값으로 내려지고,
 * 정원 초과 여부는 슬롯 유니크 제약이 최종적으로 보장한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationEngine {

    private final EventLookup eventLookup;
    private final UserLookup userLookup;
    private final CapacityPolicy capacityPolicy;
    private final RegistrationLedger ledger;
    private final PromotionCoordinator promotionCoordinator;
    private final RetryTemplate registrationRetryTemplate;

    public RegistrationResponse register(Long userId, Long eventId) {
        if (!userLookup.exists(userId)) {
            throw new UserNotFoundException("사용자를 찾을 수 없습니다: " + userId);
        }
        requireEvent(eventId);

        if (ledger.get(userId, eventId).isPresent()) {
            throw new DuplicateRegistrationException(
                    "이미 등록된 이벤트입니다: userId=" + userId + ", eventId=" + eventId);
        }

        Registration registration;
        try {
            registration = registrationRetryTemplate.execute(context -> attempt(userId, eventId));
        } catch (SlotContendedException e) {
            log.error("등록 재시도 한도 초과: userId={}, eventId={}", userId, eventId);
            throw new TransientConflictException("등록 요청이 몰려 처리하지 못했습니다. 다시 시도해주세요.");
        }

        if (registration.isWaitlisted()) {
            // 판단 이후 커밋된 취소가 슬롯을 비웠을 수 있다
            fillVacancies(eventId);
            registration = ledger.get(userId, eventId).orElse(registration);
        }
        return RegistrationResponse.from(registration);
    }

    public CancellationResponse cancel(Long userId, Long eventId) {
        EventCapacity event = requireEvent(eventId);
        CancellationResult result = promotionCoordinator.cancelAndMaybePromote(userId, eventId, event.capacity());
        if (result.cancelledStatus() != RegistrationStatus.CONFIRMED) {
            return CancellationResponse.from(result);
        }

        // 취소 트랜잭션이 보지 못한 대기 등록을 커밋 후에 다시 확인
        List<Long> promoted = fillVacancies(eventId);
        if (result.promotedUserId() == null && !promoted.isEmpty()) {
            result = new CancellationResult(userId, eventId, result.cancelledStatus(), promoted.get(0));
        }
        return CancellationResponse.from(result);
    }

    /**
     * 현재 정원 기준으로 빈 슬롯을 대기열 선두에게 채운다. 이벤트가 이미 삭제됐으면 아무것도 하지 않는다.
     */
    public List<Long> fillVacancies(Long eventId) {
        return eventLookup.lookup(eventId)
                .map(event -> promotionCoordinator.fillVacancies(eventId, event.capacity()))
                .orElse(List.of());
    }

    public List<UserRegistrationResponse> listForUser(Long userId) {
        if (!userLookup.exists(userId)) {
            throw new UserNotFoundException("사용자를 찾을 수 없습니다: " + userId);
        }
        return ledger.listByUser(userId).stream()
                .map(UserRegistrationResponse::from)
                .toList();
    }

    public List<EventRegistrationResponse> listForEvent(Long eventId, RegistrationStatus statusFilter) {
        requireEvent(eventId);
        return ledger.listByEvent(eventId, statusFilter).stream()
                .map(EventRegistrationResponse::from)
                .toList();
    }

    public RegistrationSummaryResponse summarize(Long eventId) {
        EventCapacity event = requireEvent(eventId);
        long confirmed = ledger.countConfirmed(eventId);
        long waitlisted = ledger.countWaitlisted(eventId);
        return new RegistrationSummaryResponse(
                eventId,
                event.capacity(),
                event.hasWaitlist(),
                confirmed,
                waitlisted,
                Math.max(0, event.capacity() - confirmed)
        );
    }

    // 한 번의 시도: 매번 정원/대기열 설정과 확정 슬롯을 새로 읽는다
    private Registration attempt(Long userId, Long eventId) {
        EventCapacity event = requireEvent(eventId);
        List<Integer> occupiedSlots = ledger.occupiedSlots(eventId);

        CapacityDecision decision = capacityPolicy.decide(
                occupiedSlots.size(), event.capacity(), event.hasWaitlist());

        return switch (decision) {
            case REJECT -> throw new CapacityExceededException("정원이 마감되었습니다: eventId=" + eventId);
            case CONFIRM -> create(userId, eventId, RegistrationStatus.CONFIRMED,
                    lowestFreeSlot(occupiedSlots, event.capacity()));
            case WAITLIST -> create(userId, eventId, RegistrationStatus.WAITLISTED, null);
        };
    }

    private Registration create(Long userId, Long eventId, RegistrationStatus status, Integer slot) {
        CreateResult result = ledger.tryCreate(userId, eventId, status, slot);
        return switch (result.outcome()) {
            case CREATED -> {
                log.info("등록 완료: userId={}, eventId={}, status={}", userId, eventId, status);
                yield result.registration();
            }
            case ALREADY_EXISTS -> throw new DuplicateRegistrationException(
                    "이미 등록된 이벤트입니다: userId=" + userId + ", eventId=" + eventId);
            case SLOT_TAKEN -> {
                log.warn("슬롯 경합, 재시도: userId={}, eventId={}, slot={}", userId, eventId, slot);
                throw new SlotContendedException(eventId, slot);
            }
        };
    }

    private EventCapacity requireEvent(Long eventId) {
        return eventLookup.lookup(eventId)
                .orElseThrow(() -> new EventNotFoundException("이벤트를 찾을 수 없습니다: " + eventId));
    }

    static int lowestFreeSlot(List<Integer> occupiedSlots, int capacity) {
        Set<Integer> taken = new HashSet<>(occupiedSlots);
        for (int slot = 1; slot <= capacity; slot++) {
            if (!taken.contains(slot)) {
                return slot;
            }
        }
        throw new IllegalStateException("빈 슬롯이 없습니다: capacity=" + capacity);
    }
}
