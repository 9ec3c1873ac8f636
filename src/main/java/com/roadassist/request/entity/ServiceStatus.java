package com.roadassist.request.entity;

/**
 * Lifecycle of a service request. Legal edges are listed in {@link ServiceTransitions};
 * COMPLETED and CANCELLED are terminal.
 */
public enum ServiceStatus {
    SUBMITTED,
    ASSIGNED,
    IN_PROGRESS,
    REACHED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
