package com.events.catalog.repository;

import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RegistrationRepository extends JpaRepository<Registration, Long> {

    Optional<Registration> findByUserIdAndEventId(Long userId, Long eventId);

    boolean existsByUserIdAndEventId(Long userId, Long eventId);

    long countByEventIdAndStatus(Long eventId, RegistrationStatus status);

    List<Registration> findByUserIdOrderByIdAsc(Long userId);

    List<Registration> findByEventIdOrderByIdAsc(Long eventId);

    List<Registration> findByEventIdAndStatusOrderByIdAsc(Long eventId, RegistrationStatus status);

    // 대기열 선두: 순서 키(id)가 가장 작은 WAITLISTED
    Optional<Registration> findFirstByEventIdAndStatusOrderByIdAsc(Long eventId, RegistrationStatus status);

    @Query("SELECT r.slot FROM Registration r WHERE r.eventId = :eventId "
            + "AND r.status = com.events.catalog.domain.RegistrationStatus.CONFIRMED")
    List<Integer> findOccupiedSlots(@Param("eventId") Long eventId);

    // 조건부 삭제: 방금 읽은 상태가 그대로일 때만 지운다
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Registration r WHERE r.id = :id AND r.status = :status")
    int deleteByIdAndStatus(@Param("id") Long id, @Param("status") RegistrationStatus status);

    // CAS 승격: 아직 WAITLISTED일 때만 CONFIRMED로 바꾸고 슬롯을 넘겨받는다
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Registration r SET r.status = com.events.catalog.domain.RegistrationStatus.CONFIRMED, "
            + "r.slot = :slot WHERE r.userId = :userId AND r.eventId = :eventId "
            + "AND r.status = com.events.catalog.domain.RegistrationStatus.WAITLISTED")
    int promoteIfWaitlisted(@Param("userId") Long userId,
                            @Param("eventId") Long eventId,
                            @Param("slot") int slot);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Registration r WHERE r.eventId = :eventId")
    int deleteAllByEventId(@Param("eventId") Long eventId);
}
