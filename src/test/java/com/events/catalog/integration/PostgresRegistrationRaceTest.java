package com.events.catalog.integration;

import com.events.catalog.config.TestContainersConfig;
import com.events.catalog.domain.Registration;
import com.events.catalog.domain.RegistrationStatus;
import com.events.catalog.repository.EventRepository;
import com.events.catalog.repository.RegistrationRepository;
import com.events.catalog.repository.UserRepository;
import com.events.catalog.service.registration.RegistrationEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 행 잠금과 유니크 인덱스 대기 동작이 실제 PostgreSQL에서 어떻게 맞물리는지 확인한다. Docker가 없으면 건너뛴다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestContainersConfig.class)
@Testcontainers(disabledWithoutDocker = true)
class PostgresRegistrationRaceTest {

    @Autowired private RegistrationEngine registrationEngine;
    @Autowired private EventRepository eventRepository;
    @Autowired private UserRepository userRepository;
    @Autowired private RegistrationRepository registrationRepository;

    private List<Throwable> runConcurrently(List<Long> userIds, Consumer<Long> action) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(userIds.size());
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(userIds.size());
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();

        for (Long userId : userIds) {
            executor.submit(() -> {
                try {
                    start.await();
                    action.accept(userId);
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(120, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        return List.copyOf(failures);
    }

    @Test
    @DisplayName("동시 등록 후 확정자 전원 동시 취소 → 가장 먼저 대기한 사람들이 정확히 한 번씩 승격")
    void concurrent_register_then_concurrent_cancel() throws InterruptedException {
        int capacity = 7;
        int userCount = 30;
        Long eventId = RegistrationFixtures.event(eventRepository, capacity, true).getId();
        List<Long> userIds = RegistrationFixtures.users(userRepository, userCount);

        assertThat(runConcurrently(userIds, userId -> registrationEngine.register(userId, eventId))).isEmpty();

        List<Registration> afterRegister = registrationRepository.findByEventIdOrderByIdAsc(eventId);
        assertThat(afterRegister).hasSize(userCount);
        assertThat(afterRegister).filteredOn(Registration::isConfirmed).hasSize(capacity);

        List<Long> confirmedUsers = afterRegister.stream()
                .filter(Registration::isConfirmed)
                .map(Registration::getUserId)
                .toList();
        Set<Long> expectedPromoted = afterRegister.stream()
                .filter(Registration::isWaitlisted)
                .sorted(Comparator.comparing(Registration::getOrderingKey))
                .limit(capacity)
                .map(Registration::getUserId)
                .collect(Collectors.toSet());

        assertThat(runConcurrently(confirmedUsers, userId -> registrationEngine.cancel(userId, eventId))).isEmpty();

        List<Registration> afterCancel = registrationRepository.findByEventIdOrderByIdAsc(eventId);
        assertThat(afterCancel).hasSize(userCount - capacity);
        assertThat(afterCancel).filteredOn(Registration::isConfirmed)
                .extracting(Registration::getUserId)
                .containsExactlyInAnyOrderElementsOf(expectedPromoted);
        assertThat(registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.WAITLISTED))
                .isEqualTo(userCount - 2L * capacity);
    }
}
