package com.events.catalog.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * (사용자, 이벤트) 한 쌍의 등록 레코드.
 * <p>
 * 상태 전이는 엔티티 메서드가 아니라 {@code RegistrationRepository}의 조건부 UPDATE/DELETE로만 일어난다.
 * 여러 인스턴스가 같은 이벤트에 동시에 쓰므로, 읽은 값을 고쳐 저장하는 방식으로는 정원을 지킬 수 없다.
 */
@Entity
@Table(name = "registrations",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_registration_user_event", columnNames = {"user_id", "event_id"}),
                @UniqueConstraint(name = "uk_registration_event_slot", columnNames = {"event_id", "slot_no"})
        },
        indexes = {
                @Index(name = "idx_registration_event_status", columnList = "event_id, status, id"),
                @Index(name = "idx_registration_user", columnList = "user_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Registration {

    // 순서 키: DB가 삽입 시 단조 증가로 부여한다
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "event_id", nullable = false, updatable = false)
    private Long eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RegistrationStatus status;

    // CONFIRMED만 [1, capacity] 범위의 슬롯을 점유한다. WAITLISTED는 null
    @Column(name = "slot_no")
    private Integer slot;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private LocalDateTime registeredAt;

    @PrePersist
    protected void onCreate() {
        this.registeredAt = LocalDateTime.now();
    }

    public static Registration confirmed(Long userId, Long eventId, int slot) {
        Registration registration = new Registration();
        registration.userId = userId;
        registration.eventId = eventId;
        registration.status = RegistrationStatus.CONFIRMED;
        registration.slot = slot;
        return registration;
    }

    public static Registration waitlisted(Long userId, Long eventId) {
        Registration registration = new Registration();
        registration.userId = userId;
        registration.eventId = eventId;
        registration.status = RegistrationStatus.WAITLISTED;
        return registration;
    }

    public Long getOrderingKey() {
        return id;
    }

    public boolean isConfirmed() {
        return this.status == RegistrationStatus.CONFIRMED;
    }

    public boolean isWaitlisted() {
        return this.status == RegistrationStatus.WAITLISTED;
    }
}
