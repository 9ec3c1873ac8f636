package com.roadassist.request.dto;

import com.roadassist.request.entity.ServiceStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record StatusChange(
        @NotNull ServiceStatus status,
        String message,
        @PositiveOrZero BigDecimal estimatedCost,
        @PositiveOrZero BigDecimal actualCost
) {

    public static StatusChange of(ServiceStatus status) {
        return new StatusChange(status, null, null, null);
    }
}
