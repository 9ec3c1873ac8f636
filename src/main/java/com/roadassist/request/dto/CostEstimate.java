package com.roadassist.request.dto;

public record CostEstimate(Long workshopId,
                           String vehicleType,
                           String issueType,
                           long estimatedCost,
                           String estimatedTime,
                           Breakdown breakdown) {

    public record Breakdown(long serviceCost, long partsCost, long taxes) {}
}
