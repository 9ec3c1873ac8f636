package com.roadassist.request.dto;

import jakarta.validation.constraints.NotBlank;

public record EstimateRequest(Long workshopId,
                              @NotBlank String vehicleType,
                              @NotBlank String issueType,
                              String description) {
}
