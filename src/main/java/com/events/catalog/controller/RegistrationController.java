package com.events.catalog.controller;

import com.events.catalog.domain.RegistrationStatus;
import com.events.catalog.dto.registration.CancellationResponse;
import com.events.catalog.dto.registration.EventRegistrationResponse;
import com.events.catalog.dto.registration.RegistrationRequest;
import com.events.catalog.dto.registration.RegistrationResponse;
import com.events.catalog.dto.registration.RegistrationSummaryResponse;
import com.events.catalog.dto.registration.UserRegistrationResponse;
import com.events.catalog.service.registration.RegistrationEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RegistrationController {

    private final RegistrationEngine registrationEngine;

    @PostMapping("/events/{eventId}/registrations")
    public ResponseEntity<RegistrationResponse> register(
            @PathVariable Long eventId,
            @Valid @RequestBody RegistrationRequest request) {
        RegistrationResponse response = registrationEngine.register(request.userId(), eventId);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/events/{eventId}/registrations/{userId}")
    public ResponseEntity<CancellationResponse> cancel(
            @PathVariable Long eventId,
            @PathVariable Long userId) {
        return ResponseEntity.ok(registrationEngine.cancel(userId, eventId));
    }

    @GetMapping("/events/{eventId}/registrations")
    public ResponseEntity<List<EventRegistrationResponse>> listForEvent(
            @PathVariable Long eventId,
            @RequestParam(required = false) RegistrationStatus status) {
        return ResponseEntity.ok(registrationEngine.listForEvent(eventId, status));
    }

    @GetMapping("/events/{eventId}/registrations/summary")
    public ResponseEntity<RegistrationSummaryResponse> summarize(@PathVariable Long eventId) {
        return ResponseEntity.ok(registrationEngine.summarize(eventId));
    }

    @GetMapping("/users/{userId}/registrations")
    public ResponseEntity<List<UserRegistrationResponse>> listForUser(@PathVariable Long userId) {
        return ResponseEntity.ok(registrationEngine.listForUser(userId));
    }
}
