package com.roadassist.request.dto;

import com.roadassist.request.entity.ServiceRequest;
import com.roadassist.request.entity.ServiceStatus;
import com.roadassist.request.entity.Urgency;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record ServiceRequestResponse(
        Long id,
        Long customerId,
        Long workshopId,
        Long mechanicId,
        String vehicleType,
        String vehicleMake,
        String vehicleModel,
        String issueType,
        String description,
        Urgency urgency,
        String pickupAddress,
        double latitude,
        double longitude,
        List<String> images,
        ServiceStatus status,
        BigDecimal estimatedCost,
        BigDecimal actualCost,
        LocalDateTime createdAt,
        LocalDateTime assignedAt,
        LocalDateTime startedAt,
        LocalDateTime reachedAt,
        LocalDateTime completedAt
) {

    public static ServiceRequestResponse from(ServiceRequest request) {
        return new ServiceRequestResponse(
                request.getId(),
                request.getCustomerId(),
                request.getWorkshopId(),
                request.getMechanicId(),
                request.getVehicleType(),
                request.getVehicleMake(),
                request.getVehicleModel(),
                request.getIssueType(),
                request.getDescription(),
                request.getUrgency(),
                request.getPickupAddress(),
                request.getLatitude(),
                request.getLongitude(),
                List.copyOf(request.getImages()),
                request.getStatus(),
                request.getEstimatedCost(),
                request.getActualCost(),
                request.getCreatedAt(),
                request.getAssignedAt(),
                request.getStartedAt(),
                request.getReachedAt(),
                request.getCompletedAt()
        );
    }
}
