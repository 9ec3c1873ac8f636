package com.roadassist.mechanic.entity;

/**
 * Capacity state of a mechanic. {@link #IN_SERVICE} is held exactly while the mechanic has an
 * active assignment and is only ever set by assignment and released by completion or cancellation.
 */
public enum Availability {
    AVAILABLE,
    IN_SERVICE,
    NOT_AVAILABLE
}
