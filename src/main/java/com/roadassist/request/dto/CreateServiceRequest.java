package com.roadassist.request.dto;

import com.roadassist.request.entity.Urgency;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateServiceRequest(
        @NotBlank(message = "Vehicle type is required") String vehicleType,
        String vehicleMake,
        String vehicleModel,
        @NotBlank(message = "Issue type is required") String issueType,
        @NotNull @Size(min = 10, message = "Description must be at least 10 characters") String description,
        Urgency urgency,
        @NotBlank(message = "Pickup address is required") String pickupAddress,
        @NotNull @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
        @NotNull @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude,
        List<String> images,
        Long workshopId
) {
}
