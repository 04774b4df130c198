package com.events.catalog.dto.event;

import com.events.catalog.domain.EventStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

// 모든 필드 선택. null이면 기존 값 유지
public record EventUpdateRequest(
        @Size(min = 1, max = 200, message = "제목은 1~200자입니다.")
        String title,

        @Size(min = 1, max = 1000, message = "설명은 1~1000자입니다.")
        String description,

        LocalDate eventDate,

        @Size(min = 1, max = 200, message = "장소는 1~200자입니다.")
        String location,

        @Min(value = 1, message = "정원은 1 이상이어야 합니다.")
        @Max(value = 100000, message = "정원은 100000 이하여야 합니다.")
        Integer capacity,

        @Size(min = 1, max = 100, message = "주최자는 1~100자입니다.")
        String organizer,

        EventStatus status,

        Boolean hasWaitlist
) {
}
