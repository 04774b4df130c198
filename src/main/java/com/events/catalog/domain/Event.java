package com.events.catalog.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(name = "event_date", nullable = false)
    private LocalDate eventDate;

    @Column(nullable = false, length = 200)
    private String location;

    @Column(nullable = false)
    private Integer capacity;

    @Column(nullable = false, length = 100)
    private String organizer;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventStatus status;

    // 매 등록 판단 시점에 새로 읽는다
    @Column(name = "has_waitlist", nullable = false)
    private boolean hasWaitlist;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    public static Event create(String title, String description, LocalDate eventDate, String location,
                               int capacity, String organizer, EventStatus status, boolean hasWaitlist) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("정원은 1 이상이어야 합니다: " + capacity);
        }
        Event event = new Event();
        event.title = title;
        event.description = description;
        event.eventDate = eventDate;
        event.location = location;
        event.capacity = capacity;
        event.organizer = organizer;
        event.status = status != null ? status : EventStatus.ACTIVE;
        event.hasWaitlist = hasWaitlist;
        return event;
    }

    /**
     * 전달된 값만 바꾼다. 정원을 줄여도 기존 확정 등록은 유지된다.
     */
    public void update(String title, String description, LocalDate eventDate, String location,
                       Integer capacity, String organizer, EventStatus status, Boolean hasWaitlist) {
        if (capacity != null && capacity <= 0) {
            throw new IllegalArgumentException("정원은 1 이상이어야 합니다: " + capacity);
        }
        if (title != null) this.title = title;
        if (description != null) this.description = description;
        if (eventDate != null) this.eventDate = eventDate;
        if (location != null) this.location = location;
        if (capacity != null) this.capacity = capacity;
        if (organizer != null) this.organizer = organizer;
        if (status != null) this.status = status;
        if (hasWaitlist != null) this.hasWaitlist = hasWaitlist;
    }
}
