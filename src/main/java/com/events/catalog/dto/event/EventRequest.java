package com.events.catalog.dto.event;

import com.events.catalog.domain.EventStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record EventRequest(
        @NotBlank(message = "제목은 필수입니다.")
        @Size(max = 200, message = "제목은 200자 이하입니다.")
        String title,

        @NotBlank(message = "설명은 필수입니다.")
        @Size(max = 1000, message = "설명은 1000자 이하입니다.")
        String description,

        @NotNull(message = "일자는 필수입니다.")
        LocalDate eventDate,

        @NotBlank(message = "장소는 필수입니다.")
        @Size(max = 200, message = "장소는 200자 이하입니다.")
        String location,

        @NotNull(message = "정원은 필수입니다.")
        @Min(value = 1, message = "정원은 1 이상이어야 합니다.")
        @Max(value = 100000, message = "정원은 100000 이하여야 합니다.")
        Integer capacity,

        @NotBlank(message = "주최자는 필수입니다.")
        @Size(max = 100, message = "주최자는 100자 이하입니다.")
        String organizer,

        EventStatus status,

        Boolean hasWaitlist
) {
}
