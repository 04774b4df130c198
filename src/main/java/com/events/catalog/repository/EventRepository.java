package com.events.catalog.repository;

import com.events.catalog.domain.Event;
import com.events.catalog.domain.EventStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EventRepository extends JpaRepository<Event, Long> {

    List<Event> findByStatusOrderByIdAsc(EventStatus status);

    List<Event> findAllByOrderByIdAsc();
}
