package com.events.catalog.config;

import com.events.catalog.domain.Event;
import com.events.catalog.domain.EventStatus;
import com.events.catalog.domain.User;
import com.events.catalog.repository.EventRepository;
import com.events.catalog.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@Profile("!test")
@RequiredArgsConstructor
public class DataInitializer implements ApplicationRunner {

    private static final int SAMPLE_USERS = 20;

    private final EventRepository eventRepository;
    private final UserRepository userRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (eventRepository.count() > 0) {
            log.info("샘플 데이터가 이미 존재합니다. 초기화를 건너뜁니다.");
            return;
        }

        log.info("샘플 데이터 초기화 시작");

        eventRepository.save(Event.create("Spring Meetup",
                "스프링 사용자 모임 정기 세미나", LocalDate.now().plusDays(7),
                "판교 스타트업캠퍼스", 30, "Spring User Group", EventStatus.ACTIVE, true));

        eventRepository.save(Event.create("Java Hands-on Workshop",
                "소규모 실습 워크숍", LocalDate.now().plusDays(14),
                "강남 세미나실 A", 5, "Java Korea", EventStatus.SCHEDULED, false));

        List<User> users = new ArrayList<>();
        for (int i = 1; i <= SAMPLE_USERS; i++) {
            users.add(User.create("user" + i + "@example.com", "참가자" + i));
        }
        userRepository.saveAll(users);

        log.info("샘플 데이터 초기화 완료: 이벤트 2개, 사용자 {}명", SAMPLE_USERS);
    }
}
