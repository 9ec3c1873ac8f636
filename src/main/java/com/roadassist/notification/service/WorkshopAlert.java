package com.roadassist.notification.service;

/**
 * E-mail alert to a workshop admin about a request routed to the workshop at creation.
 */
public record WorkshopAlert(
        Long workshopId,
        String workshopName,
        String adminEmail,
        Long serviceRequestId,
        String vehicleType,
        String vehicleMake,
        String vehicleModel,
        String issueType,
        String urgency,
        String pickupAddress,
        String description
) {

    public String subject() {
        return "New Service Request - " + issueType + " (" + urgency + " Priority)";
    }

    public String body() {
        return "You have a new service request assigned to your workshop:\n\n"
                + "Request ID: " + serviceRequestId + "\n"
                + "Vehicle: " + vehicleType + " " + nullToEmpty(vehicleMake) + " " + nullToEmpty(vehicleModel) + "\n"
                + "Issue Type: " + issueType + "\n"
                + "Priority: " + urgency + "\n"
                + "Location: " + pickupAddress + "\n"
                + "Description: " + description;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
