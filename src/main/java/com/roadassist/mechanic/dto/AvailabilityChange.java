package com.roadassist.mechanic.dto;

import com.roadassist.mechanic.entity.Availability;
import jakarta.validation.constraints.NotNull;

public record AvailabilityChange(@NotNull Availability availability) {
}
