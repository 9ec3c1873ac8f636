package com.roadassist.request.dto;

import jakarta.validation.constraints.NotNull;

public record AssignMechanicRequest(@NotNull Long mechanicId) {
}
