package com.roadassist.request.dto;

/**
 * Payload of every real-time request event ({@code new-service-request}, {@code task-assigned},
 * {@code status-updated} and the like).
 */
public record RequestEvent(ServiceRequestResponse serviceRequest, String message) {
}
