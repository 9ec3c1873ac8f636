package com.roadassist.mechanic.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

public record ScheduleEntryRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 2000) String description,
        @NotNull LocalDateTime startTime,
        @NotNull LocalDateTime endTime,
        boolean allDay,
        @NotBlank String type,
        Long serviceId
) {
}
