package com.events.catalog.service.event;

import com.events.catalog.common.exception.EventNotFoundException;
import com.events.catalog.domain.Event;
import com.events.catalog.domain.EventStatus;
import com.events.catalog.dto.event.EventRequest;
import com.events.catalog.dto.event.EventResponse;
import com.events.catalog.dto.event.EventUpdateRequest;
import com.events.catalog.repository.EventRepository;
import com.events.catalog.service.registration.EventCapacity;
import com.events.catalog.service.registration.EventLookup;
import com.events.catalog.service.registration.PromotionCoordinator;
import com.events.catalog.service.registration.RegistrationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EventService implements EventLookup {

    private final EventRepository eventRepository;
    private final RegistrationLedger registrationLedger;
    private final PromotionCoordinator promotionCoordinator;
    private final TransactionTemplate transactionTemplate;

    @Transactional
    public EventResponse createEvent(EventRequest request) {
        Event event = Event.create(
                request.title(),
                request.description(),
                request.eventDate(),
                request.location(),
                request.capacity(),
                request.organizer(),
                request.status(),
                Boolean.TRUE.equals(request.hasWaitlist())
        );
        eventRepository.save(event);
        log.info("이벤트 생성: eventId={}, capacity={}, hasWaitlist={}",
                event.getId(), event.getCapacity(), event.isHasWaitlist());
        return EventResponse.from(event);
    }

    /**
     * 전달된 필드만 바꾼다. 커밋 후 새 정원 기준으로 빈 슬롯을 대기열에 채운다.
     * 정원을 줄이면 기존 확정 등록은 그대로 두고, 확정 인원이 새 정원 아래로 내려갈 때까지 승격과 신규 확정을 멈춘다.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public EventResponse updateEvent(Long eventId, EventUpdateRequest request) {
        Event event = transactionTemplate.execute(status -> {
            Event found = findEvent(eventId);
            found.update(
                    request.title(),
                    request.description(),
                    request.eventDate(),
                    request.location(),
                    request.capacity(),
                    request.organizer(),
                    request.status(),
                    request.hasWaitlist()
            );
            return found;
        });
        log.info("이벤트 수정: eventId={}, capacity={}, hasWaitlist={}",
                eventId, event.getCapacity(), event.isHasWaitlist());

        promotionCoordinator.fillVacancies(eventId, event.getCapacity());
        return EventResponse.from(event);
    }

    /**
     * 이벤트와 그 이벤트의 모든 등록을 함께 지운다.
     */
    @Transactional
    public void deleteEvent(Long eventId) {
        Event event = findEvent(eventId);
        int removed = registrationLedger.deleteAllForEvent(eventId);
        eventRepository.delete(event);
        log.info("이벤트 삭제: eventId={}, registrationsRemoved={}", eventId, removed);
    }

    public EventResponse getEvent(Long eventId) {
        return EventResponse.from(findEvent(eventId));
    }

    public List<EventResponse> getEvents(EventStatus status) {
        List<Event> events = status == null
                ? eventRepository.findAllByOrderByIdAsc()
                : eventRepository.findByStatusOrderByIdAsc(status);
        return events.stream()
                .map(EventResponse::from)
                .toList();
    }

    @Override
    public Optional<EventCapacity> lookup(Long eventId) {
        return eventRepository.findById(eventId)
                .map(event -> new EventCapacity(event.getId(), event.getCapacity(), event.isHasWaitlist()));
    }

    private Event findEvent(Long eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException("이벤트를 찾을 수 없습니다: " + eventId));
    }
}
