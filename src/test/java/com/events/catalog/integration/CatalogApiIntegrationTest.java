package com.events.catalog.integration;

import com.events.catalog.domain.EventStatus;
import com.events.catalog.dto.event.EventRequest;
import com.events.catalog.dto.user.UserRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CatalogApiIntegrationTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    @Test
    @DisplayName("이벤트 생성 → 단건/상태별 조회")
    void create_and_get_event() throws Exception {
        EventRequest request = new EventRequest("카탈로그 테스트", "설명", LocalDate.now().plusDays(3),
                "장소", 50, "주최자", EventStatus.SCHEDULED, true);

        MvcResult result = mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.capacity").value(50))
                .andExpect(jsonPath("$.hasWaitlist").value(true))
                .andExpect(jsonPath("$.status").value("SCHEDULED"))
                .andReturn();

        long eventId = objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asLong();

        mockMvc.perform(get("/api/events/" + eventId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("카탈로그 테스트"));

        mockMvc.perform(get("/api/events").param("status", "SCHEDULED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == " + eventId + ")]").exists());
    }

    @Test
    @DisplayName("상태/대기열 미지정 → ACTIVE, 대기열 없음")
    void event_defaults() throws Exception {
        EventRequest request = new EventRequest("기본값", "설명", LocalDate.now(), "장소", 1, "주최자", null, null);

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.hasWaitlist").value(false));
    }

    @Test
    @DisplayName("정원 0 / 필수값 누락 → 422")
    void invalid_event() throws Exception {
        EventRequest request = new EventRequest("", "설명", LocalDate.now(), "장소", 0, "주최자", null, false);

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("없는 이벤트 조회 → 404")
    void missing_event() throws Exception {
        mockMvc.perform(get("/api/events/" + Long.MAX_VALUE))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("EVENT_NOT_FOUND"));
    }

    @Test
    @DisplayName("사용자 생성 → 조회, 같은 이메일 재가입 → 409")
    void create_user_and_reject_duplicate_email() throws Exception {
        String email = "catalog-" + System.nanoTime() + "@test.com";
        UserRequest request = new UserRequest(email, "테스터");

        MvcResult result = mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();

        long userId = objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asLong();

        mockMvc.perform(get("/api/users/" + userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email));

        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_EMAIL"));
    }

    @Test
    @DisplayName("루트/헬스 체크")
    void root_and_health() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Events API"));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }
}
