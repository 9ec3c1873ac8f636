package com.roadassist.request.service;

import com.roadassist.request.dto.CostEstimate;
import com.roadassist.request.dto.EstimateRequest;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flat price table by issue type scaled by vehicle class.
 */
@Component
public class CostEstimator {

    static final long DEFAULT_BASE_PRICE = 1000;
    static final double DEFAULT_MULTIPLIER = 1.0;
    static final String ESTIMATED_TIME = "1-2 hours";

    private static final Map<String, Long> BASE_PRICES = Map.of(
            "Engine Problem", 2000L,
            "Flat Tire", 300L,
            "Battery Issue", 800L,
            "Brake Problem", 1500L,
            "AC Issue", 1200L,
            "Oil Change", 500L,
            "General Service", 1000L
    );

    private static final Map<String, Double> VEHICLE_MULTIPLIERS = Map.of(
            "Car", 1.0,
            "Motorcycle", 0.6,
            "Truck", 1.5,
            "Bus", 2.0,
            "Auto Rickshaw", 0.8
    );

    public CostEstimate estimate(EstimateRequest request) {
        long base = BASE_PRICES.getOrDefault(request.issueType(), DEFAULT_BASE_PRICE);
        double multiplier = VEHICLE_MULTIPLIERS.getOrDefault(request.vehicleType(), DEFAULT_MULTIPLIER);
        long estimated = Math.round(base * multiplier);
        CostEstimate.Breakdown breakdown = new CostEstimate.Breakdown(
                Math.round(estimated * 0.7),
                Math.round(estimated * 0.3),
                Math.round(estimated * 0.18));
        return new CostEstimate(request.workshopId(), request.vehicleType(), request.issueType(),
                estimated, ESTIMATED_TIME, breakdown);
    }
}
