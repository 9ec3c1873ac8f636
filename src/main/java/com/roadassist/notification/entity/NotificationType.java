package com.roadassist.notification.entity;

public enum NotificationType {
    NEW_ASSIGNMENT,
    SERVICE_UPDATE,
    NEW_REQUEST,
    REQUEST_CANCELLED
}
