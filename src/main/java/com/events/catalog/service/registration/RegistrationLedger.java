package com.events.catalog.service.registration;

import com.events.catalog.common.exception.TransientConflictException;
import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;
import com.events.catalog.repository.RegistrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 등록 레코드를 쓰는 유일한 컴포넌트.
 * <p>
 * 모든 쓰기는 조건부다. 중복 등록은 (user_id, event_id) 유니크 제약으로, 정원 초과는 (event_id, slot_no) 유니크 제약으로,
 * 승격과 취소는 현재 상태를 WHERE 절에 건 UPDATE/DELETE로 막는다. 예상된 경합은 예외가 아니라
 * {@link CreateOutcome}, {@link PromoteOutcome} 값으로 돌려준다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrationLedger {

    // 상태는 WAITLISTED → CONFIRMED로 한 번만 바뀌므로 세 번이면 충분하다
    private static final int DELETE_ATTEMPTS = 3;

    private final RegistrationRepository registrationRepository;

    /**
     * 레코드가 없을 때만 삽입한다. 호출자의 트랜잭션 밖에서 불려야 실패가 다른 쓰기를 롤백시키지 않는다.
     *
     * @param slot CONFIRMED일 때 점유할 슬롯, WAITLISTED면 {@code null}
     */
    public CreateResult tryCreate(Long userId, Long eventId, RegistrationStatus status, Integer slot) {
        Registration registration = status == RegistrationStatus.CONFIRMED
                ? Registration.confirmed(userId, eventId, slot)
                : Registration.waitlisted(userId, eventId);
        try {
            return CreateResult.created(registrationRepository.saveAndFlush(registration));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            if (registrationRepository.existsByUserIdAndEventId(userId, eventId)) {
                return CreateResult.failed(CreateOutcome.ALREADY_EXISTS);
            }
            log.debug("슬롯 선점 실패: eventId={}, slot={}, cause={}", eventId, slot, e.getClass().getSimpleName());
            return CreateResult.failed(CreateOutcome.SLOT_TAKEN);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Registration> get(Long userId, Long eventId) {
        return registrationRepository.findByUserIdAndEventId(userId, eventId);
    }

    /**
     * 레코드를 지우고 삭제 직전의 모습을 돌려준다. 읽은 상태를 조건으로 지우므로, 같은 키에 대한 동시 취소는 하나만 성공한다.
     */
    @Transactional
    public Optional<Registration> delete(Long userId, Long eventId) {
        for (int attempt = 1; attempt <= DELETE_ATTEMPTS; attempt++) {
            Optional<Registration> current = registrationRepository.findByUserIdAndEventId(userId, eventId);
            if (current.isEmpty()) {
                return Optional.empty();
            }

            Registration registration = current.get();
            if (registrationRepository.deleteByIdAndStatus(registration.getId(), registration.getStatus()) == 1) {
                return current;
            }
            log.debug("삭제 조건 불일치, 다시 읽음: userId={}, eventId={}, attempt={}", userId, eventId, attempt);
        }
        throw new TransientConflictException("등록 취소 중 경합이 반복되었습니다. 다시 시도해주세요.");
    }

    // 이벤트 삭제용. 호출자의 트랜잭션에 참여한다
    @Transactional
    public int deleteAllForEvent(Long eventId) {
        return registrationRepository.deleteAllByEventId(eventId);
    }

    @Transactional(readOnly = true)
    public long countConfirmed(Long eventId) {
        return registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.CONFIRMED);
    }

    @Transactional(readOnly = true)
    public long countWaitlisted(Long eventId) {
        return registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.WAITLISTED);
    }

    @Transactional(readOnly = true)
    public List<Integer> occupiedSlots(Long eventId) {
        return registrationRepository.findOccupiedSlots(eventId);
    }

    @Transactional(readOnly = true)
    public Optional<Registration> firstWaitlisted(Long eventId) {
        return registrationRepository.findFirstByEventIdAndStatusOrderByIdAsc(eventId, RegistrationStatus.WAITLISTED);
    }

    /**
     * WAITLISTED → CONFIRMED CAS. 이미 승격됐거나 사라진 후보라면 아무것도 바꾸지 않는다.
     */
    @Transactional
    public PromoteOutcome promote(Long userId, Long eventId, int slot) {
        if (registrationRepository.promoteIfWaitlisted(userId, eventId, slot) == 1) {
            return PromoteOutcome.PROMOTED;
        }
        return registrationRepository.existsByUserIdAndEventId(userId, eventId)
                ? PromoteOutcome.ALREADY_CONFIRMED
                : PromoteOutcome.NOT_FOUND;
    }

    @Transactional(readOnly = true)
    public List<Registration> listByUser(Long userId) {
        return registrationRepository.findByUserIdOrderByIdAsc(userId);
    }

    @Transactional(readOnly = true)
    public List<Registration> listByEvent(Long eventId, RegistrationStatus statusFilter) {
        if (statusFilter == null) {
            return registrationRepository.findByEventIdOrderByIdAsc(eventId);
        }
        return registrationRepository.findByEventIdAndStatusOrderByIdAsc(eventId, statusFilter);
    }
}
