package com.roadassist.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes shared by every domain package.
 *
 * <p>Each code carries the HTTP status returned to clients, the {@link ErrorKind} used by
 * callers to react programmatically, and a default English message.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, "Invalid input value"),
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "Entity not found"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, ErrorKind.PERMISSION, "Access denied"),
    MISSING_IDENTITY(HttpStatus.UNAUTHORIZED, ErrorKind.PERMISSION, "Caller identity headers are missing"),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, ErrorKind.STATE_CONFLICT,
            "The resource was modified concurrently, please retry"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.EXTERNAL_COLLABORATOR, "Internal server error"),

    // Service request
    SERVICE_REQUEST_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "Service request not found"),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT, ErrorKind.STATE_CONFLICT, "Invalid service status transition"),
    REQUEST_ALREADY_ASSIGNED(HttpStatus.CONFLICT, ErrorKind.STATE_CONFLICT,
            "Service request is already assigned, cancel it before re-assigning"),

    // Mechanic
    MECHANIC_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "Mechanic not found"),
    MECHANIC_NOT_IN_WORKSHOP(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "Mechanic not found in your workshop"),
    MECHANIC_NOT_AVAILABLE(HttpStatus.CONFLICT, ErrorKind.STATE_CONFLICT, "Mechanic is not available"),
    SCHEDULE_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "Schedule entry not found"),

    // Workshop
    WORKSHOP_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "Workshop not found"),

    // Notification
    NOTIFICATION_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "Notification not found"),

    // External collaborators
    SIDE_EFFECT_FAILED(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.EXTERNAL_COLLABORATOR, "Side effect could not be applied"),
    PLACE_SEARCH_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.EXTERNAL_COLLABORATOR,
            "Place search provider is temporarily unavailable");

    private final HttpStatus status;
    private final ErrorKind kind;
    private final String message;
}
