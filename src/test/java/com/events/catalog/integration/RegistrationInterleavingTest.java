package com.events.catalog.integration;

import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;
import com.events.catalog.dto.registration.CancellationResponse;
import com.events.catalog.dto.registration.RegistrationResponse;
import com.events.catalog.repository.EventRepository;
import com.events.catalog.repository.RegistrationRepository;
import com.events.catalog.repository.UserRepository;
import com.events.catalog.service.registration.RegistrationEngine;
import com.events.catalog.service.registration.RegistrationLedger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doAnswer;

/**
 * 등록과 취소가 서로의 읽기-쓰기 사이에 끼어드는 순서를 고정해서 재현한다.
 * 끼어드는 쪽은 다른 스레드(다른 커넥션)에서 끝까지 실행한 뒤 원래 흐름을 이어간다.
 */
@SpringBootTest
@ActiveProfiles("test")
class RegistrationInterleavingTest {

    @Autowired private RegistrationEngine registrationEngine;
    @Autowired private EventRepository eventRepository;
    @Autowired private UserRepository userRepository;
    @Autowired private RegistrationRepository registrationRepository;

    @SpyBean private RegistrationLedger registrationLedger;

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private <T> T runElsewhere(Callable<T> task) throws Exception {
        return executor.submit(task).get(30, TimeUnit.SECONDS);
    }

    private Registration registrationOf(Long userId, Long eventId) {
        return registrationRepository.findByUserIdAndEventId(userId, eventId).orElseThrow();
    }

    @Test
    @DisplayName("슬롯을 읽은 직후 마지막 확정자가 취소되면, 대기로 판단된 등록도 빈 자리로 확정된다")
    void cancel_between_slot_read_and_waitlisted_insert() throws Exception {
        Long eventId = RegistrationFixtures.event(eventRepository, 1, true).getId();
        List<Long> users = RegistrationFixtures.users(userRepository, 2);
        registrationEngine.register(users.get(0), eventId);

        AtomicBoolean armed = new AtomicBoolean(true);
        doAnswer(invocation -> {
            Object slots = invocation.callRealMethod();
            if (armed.compareAndSet(true, false)) {
                runElsewhere(() -> registrationEngine.cancel(users.get(0), eventId));
            }
            return slots;
        }).when(registrationLedger).occupiedSlots(eventId);

        RegistrationResponse response = registrationEngine.register(users.get(1), eventId);

        assertThat(armed).isFalse();
        assertThat(response.status()).isEqualTo(RegistrationStatus.CONFIRMED);
        assertThat(registrationOf(users.get(1), eventId).getSlot()).isEqualTo(1);
        assertThat(registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.WAITLISTED)).isZero();
    }

    @Test
    @DisplayName("취소 트랜잭션이 대기열을 읽은 뒤 들어온 대기 등록은 취소 커밋 후 승격된다")
    void waitlisted_insert_after_cancel_read_the_queue() throws Exception {
        Long eventId = RegistrationFixtures.event(eventRepository, 1, true).getId();
        List<Long> users = RegistrationFixtures.users(userRepository, 2);
        registrationEngine.register(users.get(0), eventId);

        AtomicBoolean armed = new AtomicBoolean(true);
        AtomicReference<RegistrationResponse> interleaved = new AtomicReference<>();
        doAnswer(invocation -> {
            Object first = invocation.callRealMethod();
            if (armed.compareAndSet(true, false)) {
                interleaved.set(runElsewhere(() -> registrationEngine.register(users.get(1), eventId)));
            }
            return first;
        }).when(registrationLedger).firstWaitlisted(eventId);

        CancellationResponse response = registrationEngine.cancel(users.get(0), eventId);

        // 취소가 커밋되기 전이라 두 번째 사용자는 일단 대기로 들어갔다
        assertThat(interleaved.get().status()).isEqualTo(RegistrationStatus.WAITLISTED);
        assertThat(response.promotedUserId()).isEqualTo(users.get(1));
        assertThat(registrationOf(users.get(1), eventId).getStatus()).isEqualTo(RegistrationStatus.CONFIRMED);
        assertThat(registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.WAITLISTED)).isZero();
    }
}
