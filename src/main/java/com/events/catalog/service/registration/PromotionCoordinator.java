package com.events.catalog.service.registration;

import com.events.catalog.common.exception.RegistrationNotFoundException;
import com.events.catalog.common.exception.TransientConflictException;
import com.events.catalog.domain.Registration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 취소 + 대기자 승격.
 * <p>
 * 삭제와 승격을 한 트랜잭션에서 수행해, 비워진 슬롯이 커밋 시점에 이미 승격자에게 넘어가 있도록 한다.
 * 그 사이 같은 슬롯을 노리는 등록 요청은 유니크 제약에 걸려 재시도한다. 후보 경합은 CAS 실패로만 감지하고
 * 다음 후보를 다시 읽는다.
 * <p>
 * 취소 트랜잭션이 아직 커밋되지 않은 대기 등록을 보지 못하는 창이 있으므로, 대기 등록 직후와 취소 커밋 직후에
 * {@link #fillVacancies}로 빈 슬롯을 한 번 더 확인한다. 양쪽 모두 자기 쓰기를 커밋한 뒤 상대 쪽을 읽기 때문에
 * 둘 중 하나는 반드시 상대의 쓰기를 본다.
 */
@Slf4j
@Service
public class PromotionCoordinator {

    private final RegistrationLedger ledger;
    private final int maxAttempts;

    public PromotionCoordinator(RegistrationLedger ledger,
                                @Value("${registration.promotion.max-attempts:10}") int maxAttempts) {
        this.ledger = ledger;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param capacity 현재 정원. 정원이 줄어 확정 인원이 이미 정원 이상이면 비워진 슬롯을 넘기지 않는다
     */
    @Transactional
    public CancellationResult cancelAndMaybePromote(Long userId, Long eventId, int capacity) {
        Registration cancelled = ledger.delete(userId, eventId)
                .orElseThrow(() -> new RegistrationNotFoundException(
                        "등록 정보를 찾을 수 없습니다: userId=" + userId + ", eventId=" + eventId));

        if (cancelled.isWaitlisted()) {
            log.info("대기 등록 취소: userId={}, eventId={}", userId, eventId);
            return CancellationResult.withoutPromotion(cancelled);
        }

        log.info("확정 등록 취소: userId={}, eventId={}, slot={}", userId, eventId, cancelled.getSlot());
        Long promotedUserId = promoteNext(eventId, cancelled.getSlot(), capacity);
        return new CancellationResult(userId, eventId, cancelled.getStatus(), promotedUserId);
    }

    private Long promoteNext(Long eventId, int freedSlot, int capacity) {
        // 같은 트랜잭션이라 방금 지운 슬롯은 이미 빠져 있다
        List<Integer> occupiedSlots = ledger.occupiedSlots(eventId);
        if (occupiedSlots.size() >= capacity) {
            log.info("정원 축소로 승격 생략: eventId={}, confirmed={}, capacity={}",
                    eventId, occupiedSlots.size(), capacity);
            return null;
        }
        int slot = freedSlot <= capacity && !occupiedSlots.contains(freedSlot)
                ? freedSlot
                : RegistrationEngine.lowestFreeSlot(occupiedSlots, capacity);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<Registration> candidate = ledger.firstWaitlisted(eventId);
            if (candidate.isEmpty()) {
                return null;
            }

            Long candidateUserId = candidate.get().getUserId();
            PromoteOutcome outcome = ledger.promote(candidateUserId, eventId, slot);
            if (outcome == PromoteOutcome.PROMOTED) {
                log.info("대기자 승격: userId={}, eventId={}, slot={}", candidateUserId, eventId, slot);
                return candidateUserId;
            }
            log.warn("승격 후보 경합: userId={}, eventId={}, outcome={}, attempt={}",
                    candidateUserId, eventId, outcome, attempt);
        }

        log.error("승격 재시도 한도 초과: eventId={}, maxAttempts={}", eventId, maxAttempts);
        throw new TransientConflictException("대기자 승격 중 경합이 반복되었습니다. 다시 시도해주세요.");
    }

    /**
     * 빈 슬롯이 남아 있는 동안 대기열 선두를 승격한다. 트랜잭션 밖에서 불려야 하며, 승격 하나하나가 별도 트랜잭션이다.
     *
     * @return 승격된 사용자 ID, 순서 키 오름차순
     */
    public List<Long> fillVacancies(Long eventId, int capacity) {
        List<Long> promoted = new ArrayList<>();
        int conflicts = 0;
        while (conflicts < maxAttempts) {
            List<Integer> occupiedSlots = ledger.occupiedSlots(eventId);
            if (occupiedSlots.size() >= capacity) {
                return promoted;
            }
            Optional<Registration> candidate = ledger.firstWaitlisted(eventId);
            if (candidate.isEmpty()) {
                return promoted;
            }

            Long candidateUserId = candidate.get().getUserId();
            int slot = RegistrationEngine.lowestFreeSlot(occupiedSlots, capacity);
            if (tryPromote(candidateUserId, eventId, slot)) {
                log.info("빈 슬롯 승격: userId={}, eventId={}, slot={}", candidateUserId, eventId, slot);
                promoted.add(candidateUserId);
            } else {
                conflicts++;
            }
        }

        // 남은 대기자는 다음 취소나 등록 때 다시 확인된다
        log.warn("빈 슬롯 승격 경합 반복, 중단: eventId={}, promoted={}", eventId, promoted);
        return promoted;
    }

    private boolean tryPromote(Long userId, Long eventId, int slot) {
        try {
            return ledger.promote(userId, eventId, slot) == PromoteOutcome.PROMOTED;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("빈 슬롯 선점 실패: eventId={}, slot={}, cause={}", eventId, slot, e.getClass().getSimpleName());
            return false;
        }
    }
}
