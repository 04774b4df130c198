package com.events.catalog.integration;

import com.events.catalog.domain.Event;
import com.events.catalog.domain.EventStatus;
import com.events.catalog.domain.User;
import com.events.catalog.repository.EventRepository;
import com.events.catalog.repository.UserRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

final class RegistrationFixtures {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private RegistrationFixtures() {
    }

    static Event event(EventRepository eventRepository, int capacity, boolean hasWaitlist) {
        return eventRepository.save(Event.create("테스트 이벤트 " + SEQUENCE.incrementAndGet(), "설명",
                LocalDate.now().plusDays(10), "테스트 장소", capacity, "주최자", EventStatus.ACTIVE, hasWaitlist));
    }

    static User user(UserRepository userRepository) {
        long n = SEQUENCE.incrementAndGet();
        return userRepository.save(User.create("user-" + System.nanoTime() + "-" + n + "@test.com", "참가자" + n));
    }

    static List<Long> users(UserRepository userRepository, int count) {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ids.add(user(userRepository).getId());
        }
        return ids;
    }
}
